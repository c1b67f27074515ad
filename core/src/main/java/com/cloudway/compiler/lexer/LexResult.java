/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The token stream and diagnostics of one lexer run.
 */
public final class LexResult
{
    private final ImmutableList<Token> tokens;
    private final ImmutableList<LexError> errors;

    public LexResult(List<Token> tokens, List<LexError> errors) {
        this.tokens = ImmutableList.copyOf(tokens);
        this.errors = ImmutableList.copyOf(errors);
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<LexError> getErrors() {
        return errors;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
