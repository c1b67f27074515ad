/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import static java.util.Objects.requireNonNull;

/**
 * A non-fatal lexical diagnostic.
 */
public final class LexError
{
    private final String message;
    private final int line;
    private final int column;
    private final String lexeme;

    public LexError(String message, int line, int column, String lexeme) {
        this.message = requireNonNull(message);
        this.line = line;
        this.column = column;
        this.lexeme = requireNonNull(lexeme);
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getLexeme() {
        return lexeme;
    }

    public String toString() {
        return String.format("Error at Line %d, Column %d: %s (near '%s')", line, column, message, lexeme);
    }
}
