/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableSet;

import com.cloudway.compiler.lexer.Token;
import com.cloudway.compiler.lexer.TokenType;

/**
 * Renders expression tokens as target source text, with conventional
 * spacing: binary operators are surrounded by blanks, calls, indexing,
 * member access and unary operators are not.
 */
final class TokenText
{
    private TokenText() {}

    private static final ImmutableSet<TokenType> LITERALS = ImmutableSet.of(
        TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL,
        TokenType.STRING_LITERAL, TokenType.CHAR_LITERAL);

    private static final ImmutableSet<TokenType> CLOSERS = ImmutableSet.of(
        TokenType.RPAREN, TokenType.RBRACKET, TokenType.COMMA, TokenType.SEMICOLON, TokenType.DOT);

    static String render(List<Token> tokens, TargetLanguage target) {
        StringBuilder buf = new StringBuilder();
        Token prev = null;
        boolean prevOperand = false;
        boolean glue = true;

        for (Token t : tokens) {
            TokenType type = t.getType();
            boolean step = type == TokenType.INCREMENT || type == TokenType.DECREMENT;
            boolean postfix = step && prevOperand;
            boolean unary = !prevOperand
                && (type == TokenType.MINUS || type == TokenType.PLUS || type == TokenType.BITWISE_NOT || step
                    || (type == TokenType.LOGICAL_NOT && target != TargetLanguage.PYTHON));

            boolean call = (type == TokenType.LPAREN || type == TokenType.LBRACKET)
                && prev != null && (prev.is(TokenType.IDENTIFIER) || prev.is(TokenType.RBRACKET));

            if (!glue && !CLOSERS.contains(type) && !postfix && !call)
                buf.append(' ');
            buf.append(word(t, target));

            glue = type == TokenType.LPAREN || type == TokenType.LBRACKET || type == TokenType.DOT || unary;
            prevOperand = isOperand(t) || postfix;
            prev = t;
        }
        return buf.toString();
    }

    /**
     * Returns the target spelling of a single token.
     */
    static String word(Token token, TargetLanguage target) {
        String lexeme = token.getLexeme();
        boolean nullLiteral = token.is(TokenType.IDENTIFIER) && (lexeme.equals("NULL") || lexeme.equals("nullptr"));

        if (target != TargetLanguage.PYTHON)
            return nullLiteral ? "null" : lexeme;

        if (nullLiteral)
            return "None";
        switch (token.getType()) {
        case LOGICAL_AND:
            return "and";
        case LOGICAL_OR:
            return "or";
        case LOGICAL_NOT:
            return "not";
        case KEYWORD:
            String keyword = lexeme.toLowerCase(Locale.ROOT);
            if (keyword.equals("true"))
                return "True";
            if (keyword.equals("false"))
                return "False";
            return lexeme;
        default:
            return lexeme;
        }
    }

    private static boolean isOperand(Token t) {
        return t.is(TokenType.IDENTIFIER) || t.is(TokenType.KEYWORD) || LITERALS.contains(t.getType())
            || t.is(TokenType.RPAREN) || t.is(TokenType.RBRACKET);
    }
}
