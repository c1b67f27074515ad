/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Converts an automaton into an equivalent DFA by subset construction.
 * Each DFA state stands for a set of source states and is named by
 * its canonical key, e.g. {@code {q0,q1}}.
 */
public final class NfaToDfa
{
    private static final Logger logger = Logger.getLogger(NfaToDfa.class.getName());

    private NfaToDfa() {}

    /**
     * Returns a new DFA accepting the same language, or empty when the
     * source automaton is not valid. The source is not modified.
     */
    public static Optional<Automaton> convert(Automaton nfa) {
        if (!nfa.isValid()) {
            logger.fine(() -> "Cannot convert " + nfa.getId() + ": no valid initial state");
            return Optional.empty();
        }

        Automaton dfa = new Automaton(nfa.getId(), nfa.getName() + " (DFA)", AutomatonType.DFA);
        for (String symbol : nfa.getAlphabet()) {
            dfa.addToAlphabet(symbol);
        }

        Set<String> accepting = nfa.getAcceptingStateIds();
        Map<String, Set<String>> discovered = new LinkedHashMap<>();
        Deque<Set<String>> unmarked = new ArrayDeque<>();

        String initialId = nfa.getInitialState().get().getId();
        Set<String> start = nfa.epsilonClosure(Collections.singleton(initialId));
        String startKey = keyOf(start);
        discovered.put(startKey, start);
        unmarked.add(start);
        dfa.addState(new State(startKey, true, containsAny(start, accepting)));

        while (!unmarked.isEmpty()) {
            Set<String> current = unmarked.poll();
            String currentKey = keyOf(current);

            for (String symbol : nfa.getAlphabet()) {
                Set<String> next = nfa.epsilonClosure(nfa.move(current, symbol));
                if (next.isEmpty()) {
                    continue;
                }
                String nextKey = keyOf(next);
                if (!discovered.containsKey(nextKey)) {
                    discovered.put(nextKey, next);
                    unmarked.add(next);
                    dfa.addState(new State(nextKey, false, containsAny(next, accepting)));
                }
                dfa.addTransition(currentKey, nextKey, symbol);
            }
        }

        logger.fine(() -> String.format("Converted %s: %d states -> %d states",
                                        nfa.getId(), nfa.getStateCount(), dfa.getStateCount()));
        return Optional.of(dfa);
    }

    /**
     * Returns the canonical key of a state set: sorted, comma joined and
     * wrapped in braces.
     */
    static String keyOf(Set<String> stateIds) {
        return "{" + String.join(",", new TreeSet<>(stateIds)) + "}";
    }

    private static boolean containsAny(Set<String> states, Set<String> accepting) {
        return states.stream().anyMatch(accepting::contains);
    }
}
