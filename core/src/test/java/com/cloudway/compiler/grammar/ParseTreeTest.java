/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.grammar;

import org.junit.Test;
import static org.junit.Assert.*;

public class ParseTreeTest
{
    @Test
    public void arena() {
        ParseTree tree = new ParseTree("G");
        assertTrue(tree.isEmpty());
        assertEquals(ParseTree.NO_NODE, tree.getRoot());

        int f = tree.addNonTerminal("F");
        int id = tree.addTerminal("id", "x");
        tree.addChild(f, id);
        tree.setRoot(f);

        assertEquals(2, tree.size());
        assertEquals(f, tree.getRoot());
        assertEquals("x", tree.children(f).get(0).getValue());
        assertTrue(tree.node(id).isTerminal());
        assertEquals("F(id)", tree.toBracketString());
        assertEquals("Parse Tree for: G\n\nNonTerminal: F\n  Terminal: id (x)\n", tree.render());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void child_must_exist() {
        ParseTree tree = new ParseTree("G");
        tree.addChild(tree.addNonTerminal("E"), 3);
    }

    @Test
    public void empty_tree_renders() {
        assertEquals("Empty parse tree", new ParseTree("G").render());
        assertEquals("", new ParseTree("G").toBracketString());
    }
}
