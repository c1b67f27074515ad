/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * A forward cursor over a token stream. Whitespace and newline tokens are
 * dropped, and the stream always ends with an {@code END_OF_FILE} token
 * that the cursor never moves past.
 */
public final class TokenCursor
{
    private final List<Token> tokens;
    private int position;

    public TokenCursor(List<Token> source) {
        List<Token> list = new ArrayList<>(source.size() + 1);
        for (Token t : source) {
            if (t.is(TokenType.END_OF_FILE))
                break;
            if (!t.getType().isTrivia())
                list.add(t);
        }
        int line = list.isEmpty() ? 1 : list.get(list.size() - 1).getLine();
        list.add(new Token(TokenType.END_OF_FILE, "", line, 0));
        this.tokens = list;
    }

    public int position() {
        return position;
    }

    /**
     * Returns the number of tokens before the end marker.
     */
    public int size() {
        return tokens.size() - 1;
    }

    public boolean isAtEnd() {
        return position >= tokens.size() - 1;
    }

    public Token peek() {
        return tokens.get(Math.min(position, tokens.size() - 1));
    }

    public Token peek(int ahead) {
        return tokens.get(Math.min(position + ahead, tokens.size() - 1));
    }

    public Token previous() {
        return tokens.get(Math.max(0, position - 1));
    }

    /**
     * Returns the current token and moves to the next one, staying on the
     * end marker once reached.
     */
    public Token advance() {
        Token current = peek();
        if (!isAtEnd()) {
            position++;
        }
        return current;
    }

    public boolean check(TokenType type) {
        return peek().is(type);
    }

    public boolean check(TokenType type, String lexeme) {
        return peek().is(type, lexeme);
    }

    public boolean checkLexeme(String lexeme) {
        return !isAtEnd() && peek().getLexeme().equals(lexeme);
    }

    public boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    public boolean match(TokenType type, String lexeme) {
        if (check(type, lexeme)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Moves past one statement: up to and including the next semicolon or
     * braced block at the current level. An unmatched closing brace is
     * left in place.
     */
    public void skipStatement() {
        int braces = 0;
        while (!isAtEnd()) {
            Token token = peek();
            if (token.is(TokenType.RBRACE)) {
                if (braces == 0)
                    return;
                braces--;
            } else if (token.is(TokenType.LBRACE)) {
                braces++;
            }
            advance();
            if (braces == 0 && (token.is(TokenType.SEMICOLON) || token.is(TokenType.RBRACE)))
                return;
        }
    }

    /**
     * Returns the tokens from {@code from} up to, not including, the
     * current position.
     */
    public List<Token> since(int from) {
        return new ArrayList<>(tokens.subList(from, Math.min(position, tokens.size() - 1)));
    }
}
