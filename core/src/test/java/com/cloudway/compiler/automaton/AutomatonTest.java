/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import com.cloudway.compiler.automaton.TransitionCheck.Violation;

public class AutomatonTest
{
    private static Automaton twoStateDfa() {
        Automaton a = new Automaton("T", "Test", AutomatonType.DFA);
        a.addState(new State("q0", true, false));
        a.addState(new State("q1", false, true));
        return a;
    }

    @Test
    public void duplicateStateIsRejected() {
        Automaton a = twoStateDfa();
        assertFalse(a.addState(new State("q0")));
        assertEquals(2, a.getStateCount());
    }

    @Test
    public void labelDefaultsToId() {
        assertEquals("q7", new State("q7").getLabel());
        assertEquals("start", new State("q7", "start", false, false).getLabel());
    }

    @Test
    public void initialStateIsExclusive() {
        Automaton a = twoStateDfa();
        a.addState(new State("q2", true, false));
        assertEquals("q2", a.getInitialState().get().getId());
        assertFalse(a.getState("q0").get().isInitial());

        assertTrue(a.setInitialState("q1"));
        long initials = a.getStates().stream().filter(State::isInitial).count();
        assertEquals(1, initials);
        assertEquals("q1", a.getInitialState().get().getId());

        assertFalse(a.setInitialState("missing"));
        assertEquals("q1", a.getInitialState().get().getId());
    }

    @Test
    public void removeStateCascades() {
        Automaton a = Automata.endsWithAbb();
        assertTrue(a.removeState("q1"));
        for (Transition t : a.getTransitions()) {
            assertNotEquals("q1", t.getFrom());
            assertNotEquals("q1", t.getTo());
        }
        assertFalse(a.removeState("q1"));

        assertTrue(a.removeState("q0"));
        assertFalse(a.getInitialState().isPresent());
        assertFalse(a.isValid());
    }

    @Test
    public void dfaRejectsEpsilon() {
        Automaton a = twoStateDfa();
        TransitionCheck check = a.addTransition("q0", "q1", Transition.EPSILON);
        assertFalse(check.isAccepted());
        assertEquals(Violation.EPSILON_IN_DFA, check.getViolation());
        assertEquals(0, a.getTransitionCount());
    }

    @Test
    public void dfaRejectsSecondTransitionOnSameSymbol() {
        Automaton a = twoStateDfa();
        assertTrue(a.addTransition("q0", "q1", "a").isAccepted());
        TransitionCheck check = a.addTransition("q0", "q0", "a");
        assertEquals(Violation.NONDETERMINISTIC, check.getViolation());
        assertThat(check.getMessage(), containsString("'a'"));
        assertEquals(1, a.getTransitionCount());
    }

    @Test
    public void transitionNeedsExistingStates() {
        Automaton a = twoStateDfa();
        assertEquals(Violation.MISSING_STATE, a.addTransition("q0", "qx", "a").getViolation());
        assertEquals(Violation.MISSING_STATE, a.addTransition("qx", "q0", "a").getViolation());
    }

    @Test
    public void transitionNeedsSymbols() {
        Automaton a = new Automaton("N", "N", AutomatonType.NFA);
        a.addState(new State("q0", true, false));
        TransitionCheck check = a.addTransition(new Transition("q0", "q0", Collections.<String>emptyList()));
        assertEquals(Violation.EMPTY_SYMBOLS, check.getViolation());
    }

    @Test
    public void nfaAcceptsAnyWellFormedTransition() {
        Automaton a = Automata.endsWithAbb();
        assertTrue(a.addTransition("q2", "q2", "b").isAccepted());
        assertTrue(a.addTransition("q2", "q0", "").isAccepted());
    }

    @Test
    public void parallelEdgesAreMerged() {
        Automaton a = twoStateDfa();
        a.addTransition("q0", "q1", "a");
        a.addTransition("q0", "q1", "b");
        assertEquals(1, a.getTransitionCount());
        assertEquals(new TreeSet<>(Arrays.asList("a", "b")), a.getTransition("q0", "q1").get().getSymbols());
        assertEquals("a,b", a.getTransition("q0", "q1").get().getSymbolsString());
        assertEquals(new TreeSet<>(Arrays.asList("a", "b")), a.getAlphabet());
    }

    @Test
    public void removeTransitionSymbolThenEdge() {
        Automaton a = twoStateDfa();
        a.addTransition("q0", "q1", "a");
        a.addTransition("q0", "q1", "b");

        assertTrue(a.removeTransition("q0", "q1", "a"));
        assertEquals(1, a.getTransitionCount());
        assertTrue(a.removeTransition("q0", "q1", "b"));
        assertEquals(0, a.getTransitionCount());
        assertFalse(a.removeTransition("q0", "q1", null));

        a.addTransition("q0", "q1", "c");
        assertTrue(a.removeTransition("q0", "q1", null));
        assertEquals(0, a.getTransitionCount());
    }

    @Test
    public void epsilonSpellingsAreNormalized() {
        assertTrue(new Transition("a", "b", "epsilon").isEpsilon());
        assertTrue(new Transition("a", "b", "").isEpsilon());
        assertTrue(new Transition("a", "b", "ε").isEpsilon());
        assertFalse(new Transition("a", "b", "E").isEpsilon());

        Automaton a = Automata.endsWithAbb();
        a.addToAlphabet("epsilon");
        a.addToAlphabet("E");
        assertFalse(a.getAlphabet().contains(Transition.EPSILON));
        assertTrue(a.getAlphabet().contains("E"));
    }

    @Test
    public void epsilonClosure() {
        Automaton a = Automata.endsWithAbb();
        assertEquals(new TreeSet<>(Arrays.asList("q0", "q1")), a.epsilonClosure(Collections.singleton("q0")));
        assertEquals(Collections.singleton("q2"), a.epsilonClosure(Collections.singleton("q2")));
        assertTrue(a.epsilonClosure(Collections.<String>emptySet()).isEmpty());
    }

    @Test
    public void epsilonClosureIsIdempotent() {
        for (Automaton a : Arrays.asList(Automata.endsWithAbb(), Automata.thirdFromEnd())) {
            List<State> states = a.getStates();
            int n = states.size();
            for (int mask = 0; mask < (1 << n); mask++) {
                Set<String> subset = new HashSet<>();
                for (int i = 0; i < n; i++) {
                    if ((mask & (1 << i)) != 0) {
                        subset.add(states.get(i).getId());
                    }
                }
                Set<String> once = a.epsilonClosure(subset);
                assertEquals(once, a.epsilonClosure(once));
                assertTrue(once.containsAll(subset));
            }
        }
    }

    @Test
    public void dfaSimulation() {
        Automaton a = twoStateDfa();
        a.addTransition("q0", "q1", "a");
        a.addTransition("q1", "q1", "b");
        assertTrue(a.accepts("a"));
        assertTrue(a.accepts("abbb"));
        assertFalse(a.accepts(""));
        assertFalse(a.accepts("ba"));
        assertFalse(a.accepts("aa"));
    }

    @Test
    public void nfaSimulation() {
        Automaton a = Automata.endsWithAbb();
        assertTrue(a.accepts("abb"));
        assertTrue(a.accepts("babb"));
        assertTrue(a.accepts("aababb"));
        assertFalse(a.accepts(""));
        assertFalse(a.accepts("ab"));
        assertFalse(a.accepts("abba"));
        assertFalse(a.accepts("abc"));
    }

    @Test
    public void longestAcceptedPrefix() {
        Automaton a = twoStateDfa();
        a.addTransition("q0", "q1", "a");
        a.addTransition("q1", "q1", "b");
        assertEquals(3, a.longestAcceptedPrefix("xabbc", 1));
        assertEquals(0, a.longestAcceptedPrefix("xabbc", 0));
        assertEquals(0, a.longestAcceptedPrefix("xa", 2));

        Automaton nfa = Automata.endsWithAbb();
        assertEquals(6, nfa.longestAcceptedPrefix("abbabbx", 0));
        assertEquals(3, nfa.longestAcceptedPrefix("abbab", 0));
        assertEquals(0, nfa.longestAcceptedPrefix("abab", 0));
    }

    @Test
    public void simulationFollowsTransitionChanges() {
        Automaton a = twoStateDfa();
        a.addTransition("q0", "q1", "a");
        assertTrue(a.accepts("a"));
        assertFalse(a.accepts("ab"));

        a.addTransition("q1", "q1", "b");
        assertTrue(a.accepts("ab"));

        a.removeTransition("q1", "q1", "b");
        assertFalse(a.accepts("ab"));
        assertEquals(1, a.longestAcceptedPrefix("ab", 0));

        a.clear();
        assertFalse(a.accepts("a"));
    }

    @Test
    public void invalidAutomatonAcceptsNothing() {
        Automaton a = new Automaton("X", "X", AutomatonType.DFA);
        assertFalse(a.accepts(""));
        a.addState(new State("q0", false, true));
        assertFalse(a.isValid());
        assertFalse(a.accepts(""));
    }

    @Test
    public void detectType() {
        assertEquals(AutomatonType.NFA, Automata.endsWithAbb().detectType());

        Automaton a = new Automaton("D", "D", AutomatonType.NFA);
        a.addState(new State("q0", true, false));
        a.addState(new State("q1", false, true));
        a.addTransition("q0", "q1", "a");
        assertEquals(AutomatonType.DFA, a.detectType());
        assertEquals(AutomatonType.DFA, a.getType());

        a.setType(AutomatonType.NFA);
        a.addTransition("q0", "q0", "a");
        assertEquals(AutomatonType.NFA, a.detectType());
    }

    @Test
    public void nondeterministicAutomatonCannotBecomeDfa() {
        Automaton a = Automata.endsWithAbb();
        assertFalse(a.setType(AutomatonType.DFA));
        assertEquals(AutomatonType.NFA, a.getType());
    }

    @Test
    public void copyIsIndependent() {
        Automaton a = Automata.endsWithAbb();
        Automaton b = a.copy();
        b.removeState("q4");
        b.getState("q3").get().setAccepting(true);

        assertEquals(5, a.getStateCount());
        assertFalse(a.getState("q3").get().isAccepting());
        assertTrue(a.accepts("abb"));
        assertFalse(a.accepts("ab"));
        assertTrue(b.accepts("ab"));
    }

    @Test
    public void render() {
        String text = Automata.endsWithAbb().render();
        assertThat(text, containsString("Ends with abb [ABB] (NFA)"));
        assertThat(text, containsString("  ->  q0\n"));
        assertThat(text, containsString("    * q4\n"));
        assertThat(text, containsString("q0 --ε--> q1"));
    }
}
