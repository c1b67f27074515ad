/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Sample automata and bounded input enumeration shared by the tests.
 */
final class Automata
{
    private Automata() {}

    /**
     * NFA for (a|b)*abb with an epsilon move out of the start state.
     */
    static Automaton endsWithAbb() {
        Automaton a = new Automaton("ABB", "Ends with abb", AutomatonType.NFA);
        a.addState(new State("q0", true, false));
        a.addState(new State("q1"));
        a.addState(new State("q2"));
        a.addState(new State("q3"));
        a.addState(new State("q4", false, true));
        a.addTransition("q0", "q1", Transition.EPSILON);
        a.addTransition("q1", "q1", "a");
        a.addTransition("q1", "q1", "b");
        a.addTransition("q1", "q2", "a");
        a.addTransition("q2", "q3", "b");
        a.addTransition("q3", "q4", "b");
        return a;
    }

    /**
     * NFA accepting strings over {0,1} whose third symbol from the end is 1,
     * or that consist only of epsilon-reachable 0s.
     */
    static Automaton thirdFromEnd() {
        Automaton a = new Automaton("THIRD", "Third from end", AutomatonType.NFA);
        a.addState(new State("s", true, false));
        a.addState(new State("t1"));
        a.addState(new State("t2"));
        a.addState(new State("t3", false, true));
        a.addState(new State("z", false, true));
        a.addTransition("s", "s", "0");
        a.addTransition("s", "s", "1");
        a.addTransition("s", "t1", "1");
        a.addTransition("t1", "t2", "0");
        a.addTransition("t1", "t2", "1");
        a.addTransition("t2", "t3", "0");
        a.addTransition("t2", "t3", "1");
        a.addTransition("s", "z", "epsilon");
        a.addTransition("z", "z", "0");
        return a;
    }

    /**
     * DFA over {0,1} where B and C are equivalent.
     */
    static Automaton redundantDfa() {
        Automaton a = new Automaton("RED", "Redundant", AutomatonType.DFA);
        a.addState(new State("A", true, false));
        a.addState(new State("B"));
        a.addState(new State("C"));
        a.addState(new State("D", false, true));
        a.addState(new State("U"));
        a.addTransition("A", "B", "0");
        a.addTransition("A", "C", "1");
        a.addTransition("B", "D", "0");
        a.addTransition("B", "D", "1");
        a.addTransition("C", "D", "0");
        a.addTransition("C", "D", "1");
        a.addTransition("D", "D", "0");
        a.addTransition("D", "D", "1");
        a.addTransition("U", "A", "0");
        return a;
    }

    /**
     * Every string over the alphabet with length up to {@code maxLength},
     * the empty string included.
     */
    static List<String> strings(Collection<String> alphabet, int maxLength) {
        List<String> result = new ArrayList<>();
        List<String> layer = new ArrayList<>();
        layer.add("");
        result.add("");
        for (int len = 1; len <= maxLength; len++) {
            List<String> next = new ArrayList<>();
            for (String prefix : layer) {
                for (String symbol : alphabet) {
                    next.add(prefix + symbol);
                }
            }
            result.addAll(next);
            layer = next;
        }
        return result;
    }
}
