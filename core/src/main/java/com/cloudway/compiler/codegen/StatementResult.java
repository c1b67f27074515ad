/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import java.util.Optional;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of translating one statement.
 */
public final class StatementResult
{
    private static final StatementResult OK = new StatementResult(null, "", 0);

    private final FailureKind kind;
    private final String message;
    private final int line;

    private StatementResult(FailureKind kind, String message, int line) {
        this.kind = kind;
        this.message = message;
        this.line = line;
    }

    public static StatementResult ok() {
        return OK;
    }

    public static StatementResult failed(FailureKind kind, String message, int line) {
        return new StatementResult(requireNonNull(kind), requireNonNull(message), line);
    }

    public boolean isOk() {
        return kind == null;
    }

    public Optional<FailureKind> getKind() {
        return Optional.ofNullable(kind);
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public String toString() {
        return isOk() ? "OK" : String.format("Line %d: %s (%s)", line, message, kind);
    }
}
