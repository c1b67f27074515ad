/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.grammar;

import java.util.Arrays;
import java.util.Optional;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class GrammarTest
{
    @Test
    public void classifies_symbols() {
        Grammar g = Grammar.expression();
        assertTrue(g.isNonTerminal("E"));
        assertTrue(g.isNonTerminal("E'"));
        assertTrue(g.isNonTerminal("T'"));
        assertTrue(g.isTerminal("+"));
        assertTrue(g.isTerminal("id"));
        assertTrue(g.isTerminal("num"));
        assertFalse(g.isTerminal("ε"));
        assertFalse(g.isNonTerminal("ε"));
        assertEquals(5, g.getNonTerminals().size());
    }

    @Test
    public void multi_character_capitalized_symbols_are_non_terminals() {
        Grammar g = new Grammar("Stmt", "Stmt").add("Stmt", "Expr", "semi", ";");
        assertTrue(g.isNonTerminal("Expr"));
        assertTrue(g.isTerminal("semi"));
        assertTrue(g.isTerminal(";"));
    }

    @Test
    public void productions_for() {
        Grammar g = Grammar.arithmetic();
        assertEquals(3, g.getProductionsFor("E").size());
        assertEquals(3, g.getProductionsFor("F").size());
        assertTrue(g.getProductionsFor("X").isEmpty());
    }

    @Test
    public void remove_production() {
        Grammar g = new Grammar("G", "S").add("S", "a", "B").add("B", "b");
        assertFalse(g.removeProduction(5));
        assertTrue(g.removeProduction(1));
        assertEquals(1, g.getProductions().size());
        assertTrue(g.isNonTerminal("B"));
        assertFalse(g.isTerminal("b"));
    }

    @Test
    public void render() {
        String text = Grammar.simpleStatement().toString();
        assertThat(text, containsString("Grammar: Simple Statement Grammar\n"));
        assertThat(text, containsString("Start Symbol: S\n\nProductions:\n"));
        assertThat(text, containsString("  S → while E do S\n"));
    }

    @Test
    public void parse_production() {
        Production p = Production.parse("E -> T E'").get();
        assertEquals("E", p.getLhs());
        assertEquals(Arrays.asList("T", "E'"), p.getRhs());
        assertEquals("E → T E'", p.toString());

        assertEquals(p, Production.parse("E→T   E'").get());
        assertTrue(Production.parse("E' -> ε").get().isEpsilon());
        assertTrue(Production.parse("E' -> epsilon").get().isEpsilon());
        assertTrue(Production.parse("E' ->").get().isEpsilon());
        assertEquals("E' → ε", Production.parse("E' ->").get().toString());

        assertEquals(Optional.empty(), Production.parse("E T"));
        assertEquals(Optional.empty(), Production.parse("-> a"));
        assertEquals(Optional.empty(), Production.parse("A -> b -> c"));
    }
}
