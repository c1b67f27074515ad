/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import static java.util.Objects.requireNonNull;

/**
 * A parse tree kept as an arena of nodes. Nodes are addressed by index
 * and each node lists the indices of its children, so a node has exactly
 * one owner.
 */
public class ParseTree
{
    public static final int NO_NODE = -1;

    private final String grammarName;
    private final List<ParseTreeNode> nodes = new ArrayList<>();
    private int root = NO_NODE;

    public ParseTree(String grammarName) {
        this.grammarName = requireNonNull(grammarName);
    }

    public String getGrammarName() {
        return grammarName;
    }

    public int addNonTerminal(String symbol) {
        return addNode(new ParseTreeNode(symbol, symbol, false));
    }

    public int addTerminal(String symbol, String value) {
        return addNode(new ParseTreeNode(symbol, value, true));
    }

    private int addNode(ParseTreeNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    /**
     * Appends {@code child} to the children of {@code parent}.
     */
    public void addChild(int parent, int child) {
        checkIndex(child);
        node(parent).addChild(child);
    }

    public void setRoot(int index) {
        checkIndex(index);
        this.root = index;
    }

    /**
     * Returns the root index, or {@link #NO_NODE} for an empty tree.
     */
    public int getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root == NO_NODE;
    }

    public ParseTreeNode node(int index) {
        checkIndex(index);
        return nodes.get(index);
    }

    public List<ParseTreeNode> children(int index) {
        return node(index).getChildren().stream().map(nodes::get).collect(Collectors.toList());
    }

    public int size() {
        return nodes.size();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("no parse tree node " + index);
        }
    }

    /**
     * Returns an indented listing with one node per line.
     */
    public String render() {
        if (isEmpty()) {
            return "Empty parse tree";
        }
        StringBuilder out = new StringBuilder();
        out.append("Parse Tree for: ").append(grammarName).append("\n\n");
        render(out, root, 0);
        return out.toString();
    }

    private void render(StringBuilder out, int index, int depth) {
        Deque<int[]> work = new ArrayDeque<>();
        work.push(new int[] {index, depth});
        while (!work.isEmpty()) {
            int[] item = work.pop();
            ParseTreeNode n = nodes.get(item[0]);
            for (int i = 0; i < item[1]; i++) {
                out.append("  ");
            }
            if (n.isTerminal()) {
                out.append("Terminal: ").append(n.getSymbol());
                if (!n.getValue().equals(n.getSymbol())) {
                    out.append(" (").append(n.getValue()).append(')');
                }
                out.append('\n');
            } else {
                out.append("NonTerminal: ").append(n.getSymbol()).append('\n');
                List<Integer> children = n.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    work.push(new int[] {children.get(i), item[1] + 1});
                }
            }
        }
    }

    /**
     * Returns the tree shape in bracket form, e.g. {@code E(T(F(id),T'(ε)),E'(ε))}.
     */
    public String toBracketString() {
        if (isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        bracket(out, root);
        return out.toString();
    }

    private void bracket(StringBuilder out, int index) {
        // pending nodes interleaved with the separators that follow them
        Deque<Object> work = new ArrayDeque<>();
        work.push(index);
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof String) {
                out.append((String)item);
                continue;
            }
            ParseTreeNode n = nodes.get((Integer)item);
            out.append(n.getSymbol());
            if (!n.isTerminal() && !n.getChildren().isEmpty()) {
                out.append('(');
                work.push(")");
                List<Integer> children = n.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    work.push(children.get(i));
                    if (i > 0) {
                        work.push(",");
                    }
                }
            }
        }
    }

    public String toString() {
        return render();
    }
}
