/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

/**
 * Token categories. Each carries the short name used in listings.
 */
public enum TokenType
{
    KEYWORD,
    IDENTIFIER,
    INTEGER_LITERAL("INTEGER"),
    FLOAT_LITERAL("FLOAT"),
    STRING_LITERAL("STRING"),
    CHAR_LITERAL("CHAR"),

    // operators
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    MODULO,
    ASSIGN,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    GREATER_THAN,
    LESS_EQUAL,
    GREATER_EQUAL,
    LOGICAL_AND("AND"),
    LOGICAL_OR("OR"),
    LOGICAL_NOT("NOT"),
    BITWISE_AND("BIT_AND"),
    BITWISE_OR("BIT_OR"),
    BITWISE_XOR("BIT_XOR"),
    BITWISE_NOT("BIT_NOT"),
    SHIFT_LEFT,
    SHIFT_RIGHT,
    INCREMENT,
    DECREMENT,
    PLUS_ASSIGN,
    MINUS_ASSIGN,

    // delimiters
    SEMICOLON,
    COMMA,
    DOT,
    COLON,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,

    WHITESPACE,
    COMMENT,
    NEWLINE,
    UNKNOWN,
    END_OF_FILE("EOF");

    private final String displayName;

    TokenType() {
        this.displayName = name();
    }

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whitespace and newlines carry no meaning for the analysis stages.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE;
    }
}
