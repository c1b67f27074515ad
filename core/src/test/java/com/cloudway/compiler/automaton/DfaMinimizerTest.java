/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.Arrays;
import java.util.Optional;
import java.util.TreeSet;

import org.junit.Test;
import static org.junit.Assert.*;

public class DfaMinimizerTest
{
    private static void assertEquivalent(Automaton expected, Automaton actual, int maxLength) {
        for (String w : Automata.strings(expected.getAlphabet(), maxLength)) {
            assertEquals("input '" + w + "'", expected.accepts(w), actual.accepts(w));
        }
    }

    @Test
    public void equivalentStatesAreMerged() {
        Automaton dfa = Automata.redundantDfa();
        Automaton min = DfaMinimizer.minimize(dfa).get();

        assertEquals("Redundant (Minimized)", min.getName());
        assertEquals(3, min.getStateCount());
        assertTrue(min.hasState("A"));
        assertTrue(min.hasState("{B,C}"));
        assertTrue(min.hasState("D"));
        assertFalse(min.hasState("U"));
        assertEquals("A", min.getInitialState().get().getId());
        assertTrue(min.getState("D").get().isAccepting());
        assertEquals(new TreeSet<>(Arrays.asList("0", "1")),
                     min.getTransition("A", "{B,C}").get().getSymbols());
        assertEquivalent(dfa, min, 6);
    }

    @Test
    public void minimizesSubsetConstruction() {
        Automaton dfa = NfaToDfa.convert(Automata.endsWithAbb()).get();
        Automaton min = DfaMinimizer.minimize(dfa).get();

        assertEquals(4, min.getStateCount());
        assertEquals("{{q0,q1},{q1}}", min.getInitialState().get().getId());
        assertEquivalent(dfa, min, 7);
        assertEquivalent(Automata.endsWithAbb(), min, 7);
    }

    @Test
    public void neverGrows() {
        for (Automaton nfa : Arrays.asList(Automata.endsWithAbb(), Automata.thirdFromEnd())) {
            Automaton dfa = NfaToDfa.convert(nfa).get();
            Automaton min = DfaMinimizer.minimize(dfa).get();
            assertTrue(min.getStateCount() <= dfa.getStateCount());
            assertEquivalent(dfa, min, 7);
        }
    }

    @Test
    public void undefinedMovesAreNotMerged() {
        Automaton dfa = new Automaton("P", "Partial", AutomatonType.DFA);
        dfa.addState(new State("p", true, false));
        dfa.addState(new State("q"));
        dfa.addState(new State("r"));
        dfa.addState(new State("f", false, true));
        dfa.addTransition("p", "q", "a");
        dfa.addTransition("p", "r", "b");
        dfa.addTransition("q", "f", "a");

        Automaton min = DfaMinimizer.minimize(dfa).get();
        assertEquals(4, min.getStateCount());
        assertTrue(min.accepts("aa"));
        assertFalse(min.accepts("ba"));
        assertEquivalent(dfa, min, 5);
    }

    @Test
    public void representativeIsSmallestMember() {
        Automaton dfa = new Automaton("R", "Rep", AutomatonType.DFA);
        dfa.addState(new State("s", true, false));
        dfa.addState(new State("y", false, true));
        dfa.addState(new State("x", false, true));
        dfa.addTransition("s", "y", "a");
        dfa.addTransition("y", "x", "a");
        dfa.addTransition("x", "y", "a");

        Automaton min = DfaMinimizer.minimize(dfa).get();
        assertEquals(2, min.getStateCount());
        assertTrue(min.hasState("{x,y}"));
        assertEquals("{x,y}", min.getTransitionsFrom("{x,y}").get(0).getTo());
    }

    @Test
    public void sourceIsNotModified() {
        Automaton dfa = Automata.redundantDfa();
        String before = dfa.render();
        DfaMinimizer.minimize(dfa);
        assertEquals(before, dfa.render());
    }

    @Test
    public void rejectsNonDfa() {
        assertEquals(Optional.empty(), DfaMinimizer.minimize(Automata.endsWithAbb()));

        Automaton noInitial = new Automaton("X", "X", AutomatonType.DFA);
        noInitial.addState(new State("q0"));
        assertEquals(Optional.empty(), DfaMinimizer.minimize(noInitial));
    }
}
