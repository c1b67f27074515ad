/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

/**
 * The automaton that recognized a prefix of some input, and the length of
 * that prefix.
 */
public final class AutomatonMatch
{
    private final String automatonId;
    private final int length;

    public AutomatonMatch(String automatonId, int length) {
        this.automatonId = requireNonNull(automatonId);
        this.length = length;
    }

    public String getAutomatonId() {
        return automatonId;
    }

    public int getLength() {
        return length;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("automatonId", automatonId)
            .add("length", length)
            .toString();
    }
}
