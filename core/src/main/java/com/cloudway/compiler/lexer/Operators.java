/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * Operator and delimiter spellings. Two-character operators are looked up
 * before single characters so the longest spelling wins.
 */
public final class Operators
{
    private Operators() {}

    private static final ImmutableMap<String, TokenType> TWO_CHAR =
        ImmutableMap.<String, TokenType>builder()
            .put("==", TokenType.EQUAL)
            .put("!=", TokenType.NOT_EQUAL)
            .put("<=", TokenType.LESS_EQUAL)
            .put(">=", TokenType.GREATER_EQUAL)
            .put("&&", TokenType.LOGICAL_AND)
            .put("||", TokenType.LOGICAL_OR)
            .put("<<", TokenType.SHIFT_LEFT)
            .put(">>", TokenType.SHIFT_RIGHT)
            .put("++", TokenType.INCREMENT)
            .put("--", TokenType.DECREMENT)
            .put("+=", TokenType.PLUS_ASSIGN)
            .put("-=", TokenType.MINUS_ASSIGN)
            .build();

    private static final ImmutableMap<String, TokenType> ONE_CHAR =
        ImmutableMap.<String, TokenType>builder()
            .put("+", TokenType.PLUS)
            .put("-", TokenType.MINUS)
            .put("*", TokenType.MULTIPLY)
            .put("/", TokenType.DIVIDE)
            .put("%", TokenType.MODULO)
            .put("=", TokenType.ASSIGN)
            .put("<", TokenType.LESS_THAN)
            .put(">", TokenType.GREATER_THAN)
            .put("!", TokenType.LOGICAL_NOT)
            .put("&", TokenType.BITWISE_AND)
            .put("|", TokenType.BITWISE_OR)
            .put("^", TokenType.BITWISE_XOR)
            .put("~", TokenType.BITWISE_NOT)
            .put(";", TokenType.SEMICOLON)
            .put(",", TokenType.COMMA)
            .put(".", TokenType.DOT)
            .put(":", TokenType.COLON)
            .put("(", TokenType.LPAREN)
            .put(")", TokenType.RPAREN)
            .put("{", TokenType.LBRACE)
            .put("}", TokenType.RBRACE)
            .put("[", TokenType.LBRACKET)
            .put("]", TokenType.RBRACKET)
            .build();

    /**
     * Returns the operator type of a one or two character spelling.
     */
    public static Optional<TokenType> lookup(String spelling) {
        TokenType type = TWO_CHAR.get(spelling);
        return Optional.ofNullable(type != null ? type : ONE_CHAR.get(spelling));
    }

    public static Optional<TokenType> lookupTwoChar(String spelling) {
        return Optional.ofNullable(TWO_CHAR.get(spelling));
    }

    public static Optional<TokenType> lookupOneChar(char c) {
        return Optional.ofNullable(ONE_CHAR.get(String.valueOf(c)));
    }
}
