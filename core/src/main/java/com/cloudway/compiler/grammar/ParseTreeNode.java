/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import static java.util.Objects.requireNonNull;

/**
 * A node stored in a {@link ParseTree}. Children are referenced by their
 * index in the owning tree.
 */
public final class ParseTreeNode
{
    private final String symbol;
    private final String value;
    private final boolean terminal;
    private final List<Integer> children = new ArrayList<>();

    ParseTreeNode(String symbol, String value, boolean terminal) {
        this.symbol = requireNonNull(symbol);
        this.value = requireNonNull(value);
        this.terminal = terminal;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the matched text of a terminal, or the symbol itself.
     */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(int index) {
        children.add(index);
    }
}
