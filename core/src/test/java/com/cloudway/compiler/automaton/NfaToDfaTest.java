/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.Test;
import static org.junit.Assert.*;

public class NfaToDfaTest
{
    @Test
    public void convertedDfaAcceptsSameLanguage() {
        for (Automaton nfa : Arrays.asList(Automata.endsWithAbb(), Automata.thirdFromEnd())) {
            Automaton dfa = NfaToDfa.convert(nfa).get();
            assertEquals(AutomatonType.DFA, dfa.getType());
            for (String w : Automata.strings(nfa.getAlphabet(), 7)) {
                assertEquals("input '" + w + "' of " + nfa.getId(), nfa.accepts(w), dfa.accepts(w));
            }
        }
    }

    @Test
    public void statesAreNamedBySortedSubset() {
        Automaton dfa = NfaToDfa.convert(Automata.endsWithAbb()).get();
        assertEquals("Ends with abb (DFA)", dfa.getName());
        assertEquals("{q0,q1}", dfa.getInitialState().get().getId());
        assertEquals(5, dfa.getStateCount());
        assertTrue(dfa.hasState("{q1,q2}"));
        assertTrue(dfa.hasState("{q1,q4}"));
        assertTrue(dfa.getState("{q1,q4}").get().isAccepting());
        assertFalse(dfa.getState("{q1,q3}").get().isAccepting());
        assertEquals("{q1,q2}", dfa.getTransitionsFrom("{q1,q3}").stream()
            .filter(t -> t.hasSymbol("a")).findFirst().get().getTo());
    }

    @Test
    public void emptyMovesProduceNoTransition() {
        Automaton nfa = new Automaton("P", "Partial", AutomatonType.NFA);
        nfa.addState(new State("a", true, false));
        nfa.addState(new State("b", false, true));
        nfa.addTransition("a", "b", "x");
        nfa.addToAlphabet("y");

        Automaton dfa = NfaToDfa.convert(nfa).get();
        assertEquals(2, dfa.getStateCount());
        assertEquals(1, dfa.getTransitionCount());
        assertFalse(dfa.accepts("y"));
        assertTrue(dfa.accepts("x"));
    }

    @Test
    public void sourceIsNotModified() {
        Automaton nfa = Automata.endsWithAbb();
        String before = nfa.render();
        NfaToDfa.convert(nfa);
        assertEquals(before, nfa.render());
        assertEquals(AutomatonType.NFA, nfa.getType());
    }

    @Test
    public void invalidAutomatonFails() {
        Automaton nfa = new Automaton("X", "X", AutomatonType.NFA);
        assertEquals(Optional.empty(), NfaToDfa.convert(nfa));

        nfa.addState(new State("q0"));
        assertEquals(Optional.empty(), NfaToDfa.convert(nfa));
    }

    @Test
    public void canonicalKey() {
        assertEquals("{a,b,c}", NfaToDfa.keyOf(new java.util.HashSet<>(Arrays.asList("c", "a", "b"))));
        assertEquals("{}", NfaToDfa.keyOf(Collections.<String>emptySet()));
    }
}
