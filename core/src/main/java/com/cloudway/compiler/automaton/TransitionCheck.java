/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of validating a transition against an automaton.
 */
public final class TransitionCheck
{
    public enum Violation {
        NONE,
        MISSING_STATE,
        EPSILON_IN_DFA,
        NONDETERMINISTIC,
        EMPTY_SYMBOLS
    }

    private static final TransitionCheck ACCEPTED = new TransitionCheck(Violation.NONE, "");

    private final Violation violation;
    private final String message;

    private TransitionCheck(Violation violation, String message) {
        this.violation = violation;
        this.message = message;
    }

    public static TransitionCheck accepted() {
        return ACCEPTED;
    }

    public static TransitionCheck rejected(Violation violation, String message) {
        if (requireNonNull(violation) == Violation.NONE) {
            throw new IllegalArgumentException("a rejection needs a violation");
        }
        return new TransitionCheck(violation, requireNonNull(message));
    }

    public boolean isAccepted() {
        return violation == Violation.NONE;
    }

    public Violation getViolation() {
        return violation;
    }

    public String getMessage() {
        return message;
    }

    public String toString() {
        return isAccepted() ? "accepted" : violation + ": " + message;
    }
}
