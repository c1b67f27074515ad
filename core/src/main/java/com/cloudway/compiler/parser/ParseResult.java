/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.parser;

import java.util.List;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

import com.cloudway.compiler.grammar.ParseTree;

public final class ParseResult
{
    private final ParseTree tree;
    private final ImmutableList<ParseError> errors;

    public ParseResult(ParseTree tree, List<ParseError> errors) {
        this.tree = requireNonNull(tree);
        this.errors = ImmutableList.copyOf(errors);
    }

    /**
     * Returns the parse tree, which may be partial when errors occurred.
     */
    public ParseTree getTree() {
        return tree;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
