/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.Objects;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * A logical automaton state. The initial flag is managed by the owning
 * {@link Automaton}, which keeps at most one state initial.
 */
public class State
{
    private final String id;
    private String label;
    private boolean initial;
    private boolean accepting;

    public State(String id) {
        this(id, false, false);
    }

    public State(String id, boolean initial, boolean accepting) {
        this(id, null, initial, accepting);
    }

    public State(String id, String label, boolean initial, boolean accepting) {
        requireNonNull(id);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("state id must not be empty");
        }
        this.id = id;
        this.label = Strings.isNullOrEmpty(label) ? id : label;
        this.initial = initial;
        this.accepting = accepting;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = Strings.isNullOrEmpty(label) ? id : label;
    }

    public boolean isInitial() {
        return initial;
    }

    void setInitial(boolean initial) {
        this.initial = initial;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    State copy() {
        return new State(id, label, initial, accepting);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof State))
            return false;
        State other = (State)obj;
        return id.equals(other.id)
            && label.equals(other.label)
            && initial == other.initial
            && accepting == other.accepting;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, initial, accepting);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("id", id)
            .add("label", label.equals(id) ? null : label)
            .add("initial", initial)
            .add("accepting", accepting)
            .toString();
    }
}
