/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.semantic;

import static java.util.Objects.requireNonNull;

/**
 * A diagnostic reported by the semantic analyzer.
 */
public final class SemanticError
{
    public enum Severity { ERROR, WARNING }

    private final String message;
    private final int line;
    private final Severity severity;

    public SemanticError(String message, int line, Severity severity) {
        this.message = requireNonNull(message);
        this.line = line;
        this.severity = requireNonNull(severity);
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }

    public String toString() {
        return String.format("Line %d: %s", line, message);
    }
}
