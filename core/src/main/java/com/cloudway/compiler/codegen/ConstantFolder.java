/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;

import com.cloudway.compiler.lexer.Token;
import com.cloudway.compiler.lexer.TokenType;

/**
 * Replaces {@code int + int} literal triples with their sum, repeatedly,
 * so chains like {@code 1 + 2 + 3} collapse to a single literal.
 *
 * <p>A triple is only folded when neither neighbour binds tighter or
 * associates to the left across it, so {@code a * 2 + 3} and
 * {@code a - 2 + 3} are left alone, and neither is an operand of a
 * unary operator such as {@code ~1 + 2}. Sums that overflow an
 * {@code int} and octal literals like {@code 010} are not folded.</p>
 */
public final class ConstantFolder
{
    private ConstantFolder() {}

    private static final ImmutableSet<TokenType> LEFT_BLOCKERS = ImmutableSet.of(
        TokenType.MULTIPLY, TokenType.DIVIDE, TokenType.MODULO, TokenType.MINUS,
        TokenType.BITWISE_NOT, TokenType.LOGICAL_NOT, TokenType.INCREMENT, TokenType.DECREMENT);

    private static final ImmutableSet<TokenType> RIGHT_BLOCKERS = ImmutableSet.of(
        TokenType.MULTIPLY, TokenType.DIVIDE, TokenType.MODULO);

    /**
     * Folds a token stream. Whitespace and newline tokens are dropped
     * first so that literals separated by blanks are adjacent.
     */
    public static List<Token> fold(List<Token> tokens) {
        List<Token> current = new ArrayList<>();
        for (Token t : tokens) {
            if (!t.getType().isTrivia())
                current.add(t);
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            List<Token> next = new ArrayList<>(current.size());
            for (int i = 0; i < current.size(); i++) {
                Token folded = i + 2 < current.size() ? foldAt(current, i, next) : null;
                if (folded != null) {
                    next.add(folded);
                    i += 2;
                    changed = true;
                } else {
                    next.add(current.get(i));
                }
            }
            current = next;
        }
        return current;
    }

    private static Token foldAt(List<Token> tokens, int i, List<Token> emitted) {
        Token left = tokens.get(i), op = tokens.get(i + 1), right = tokens.get(i + 2);
        if (!left.is(TokenType.INTEGER_LITERAL) || !op.is(TokenType.PLUS) || !right.is(TokenType.INTEGER_LITERAL))
            return null;

        if (!emitted.isEmpty() && LEFT_BLOCKERS.contains(emitted.get(emitted.size() - 1).getType()))
            return null;
        if (i + 3 < tokens.size() && RIGHT_BLOCKERS.contains(tokens.get(i + 3).getType()))
            return null;

        if (isOctal(left.getLexeme()) || isOctal(right.getLexeme()))
            return null;

        Integer a = Ints.tryParse(left.getLexeme());
        Integer b = Ints.tryParse(right.getLexeme());
        if (a == null || b == null)
            return null;

        long sum = (long)a + b;
        if (sum != (int)sum)
            return null;
        return left.withLexeme(TokenType.INTEGER_LITERAL, Long.toString(sum));
    }

    private static boolean isOctal(String lexeme) {
        return lexeme.length() > 1 && lexeme.charAt(0) == '0';
    }
}
