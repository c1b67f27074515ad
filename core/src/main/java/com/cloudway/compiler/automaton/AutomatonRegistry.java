/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;

/**
 * An insertion ordered collection of automata keyed by id. The registry
 * keeps its own copies, so later changes to an added automaton do not
 * affect matching.
 */
public class AutomatonRegistry implements AutomatonMatcher
{
    private static final Logger logger = Logger.getLogger(AutomatonRegistry.class.getName());

    public static final String IDENTIFIER = "IDENTIFIER";
    public static final String INTEGER = "INTEGER";
    public static final String FLOAT = "FLOAT";

    private final Map<String, Automaton> automata = new LinkedHashMap<>();

    /**
     * Creates a registry holding the identifier, integer and float automata.
     */
    public static AutomatonRegistry withDefaults() {
        AutomatonRegistry registry = new AutomatonRegistry();
        registry.add(identifierAutomaton());
        registry.add(integerAutomaton());
        registry.add(floatAutomaton());
        return registry;
    }

    /**
     * Adds a copy of the automaton.
     *
     * @return false if an automaton with the same id is already registered
     */
    public boolean add(Automaton automaton) {
        requireNonNull(automaton);
        if (automata.containsKey(automaton.getId())) {
            logger.fine(() -> "Automaton " + automaton.getId() + " is already registered");
            return false;
        }
        automata.put(automaton.getId(), automaton.copy());
        return true;
    }

    public boolean remove(String id) {
        return automata.remove(id) != null;
    }

    /**
     * Returns a copy of the registered automaton.
     */
    public Optional<Automaton> get(String id) {
        return Optional.ofNullable(automata.get(id)).map(Automaton::copy);
    }

    public boolean contains(String id) {
        return automata.containsKey(id);
    }

    public Set<String> getIds() {
        return ImmutableSet.copyOf(automata.keySet());
    }

    public int size() {
        return automata.size();
    }

    public void clear() {
        automata.clear();
    }

    @Override
    public Optional<String> findMatchingAutomaton(String text) {
        return automata.values().stream()
            .filter(a -> a.accepts(text))
            .map(Automaton::getId)
            .findFirst();
    }

    @Override
    public Optional<AutomatonMatch> findLongestMatch(CharSequence input, int start) {
        AutomatonMatch best = null;
        for (Automaton a : automata.values()) {
            int length = a.longestAcceptedPrefix(input, start);
            if (length > 0 && (best == null || length > best.getLength())) {
                best = new AutomatonMatch(a.getId(), length);
            }
        }
        return Optional.ofNullable(best);
    }

    public List<String> findAllMatchingAutomata(String text) {
        return automata.values().stream()
            .filter(a -> a.accepts(text))
            .map(Automaton::getId)
            .collect(Collectors.toList());
    }

    // Default automata

    private static Automaton identifierAutomaton() {
        Automaton a = new Automaton(IDENTIFIER, "Identifier", AutomatonType.DFA);
        a.addState(new State("q0", true, false));
        a.addState(new State("q1", false, true));
        for (char c = 'a'; c <= 'z'; c++) {
            letter(a, String.valueOf(c));
            letter(a, String.valueOf(Character.toUpperCase(c)));
        }
        letter(a, "_");
        digits(a, "q1", "q1");
        return a;
    }

    private static void letter(Automaton a, String symbol) {
        a.addTransition("q0", "q1", symbol);
        a.addTransition("q1", "q1", symbol);
    }

    private static Automaton integerAutomaton() {
        Automaton a = new Automaton(INTEGER, "Integer", AutomatonType.DFA);
        a.addState(new State("q0", true, false));
        a.addState(new State("q1", false, true));
        digits(a, "q0", "q1");
        digits(a, "q1", "q1");
        return a;
    }

    private static Automaton floatAutomaton() {
        Automaton a = new Automaton(FLOAT, "Float", AutomatonType.DFA);
        a.addState(new State("q0", true, false));
        a.addState(new State("q1"));
        a.addState(new State("q2"));
        a.addState(new State("q3", false, true));
        digits(a, "q0", "q1");
        digits(a, "q1", "q1");
        a.addTransition("q1", "q2", ".");
        digits(a, "q2", "q3");
        digits(a, "q3", "q3");
        return a;
    }

    private static void digits(Automaton a, String from, String to) {
        for (char c = '0'; c <= '9'; c++) {
            a.addTransition(from, to, String.valueOf(c));
        }
    }
}
