/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import java.util.Objects;
import static java.util.Objects.requireNonNull;

/**
 * An immutable lexical token.
 */
public final class Token
{
    private final TokenType type;
    private final String lexeme;
    private final String automatonId;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, line, column, null);
    }

    public Token(TokenType type, String lexeme, int line, int column, String automatonId) {
        this.type = requireNonNull(type);
        this.lexeme = requireNonNull(lexeme);
        this.line = line;
        this.column = column;
        this.automatonId = automatonId;
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Returns the display name of the token type, e.g. {@code INTEGER}.
     */
    public String getTypeName() {
        return type.getDisplayName();
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * Returns the id of the automaton that recognized this token, or null
     * for tokens produced by other rules.
     */
    public String getAutomatonId() {
        return automatonId;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean is(TokenType type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    /**
     * A token is valid unless it is unknown or the end marker.
     */
    public boolean isValid() {
        return type != TokenType.UNKNOWN && type != TokenType.END_OF_FILE;
    }

    /**
     * Returns a copy of this token with a different type and lexeme at the
     * same position.
     */
    public Token withLexeme(TokenType type, String lexeme) {
        return new Token(type, lexeme, line, column, null);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Token))
            return false;
        Token other = (Token)obj;
        return type == other.type
            && lexeme.equals(other.lexeme)
            && line == other.line
            && column == other.column
            && Objects.equals(automatonId, other.automatonId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme, line, column, automatonId);
    }

    public String toString() {
        return String.format("Token(%s, \"%s\", Line: %d, Col: %d)", getTypeName(), lexeme, line, column);
    }
}
