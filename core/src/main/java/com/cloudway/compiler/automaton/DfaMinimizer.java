/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Minimizes a DFA with the table-filling algorithm.
 *
 * <p>Missing transitions lead to an implicit dead state that takes part in
 * the pair table, so a state with an undefined move is distinguished from
 * one whose move can still reach acceptance. The dead state itself never
 * appears in the result.</p>
 *
 * <p>Each equivalence class becomes one state named by its sorted members,
 * e.g. {@code {q1,q2}}; a singleton class keeps its original id. The
 * lexicographically smallest member is the class representative whose
 * transitions the merged state takes over.</p>
 */
public final class DfaMinimizer
{
    private static final Logger logger = Logger.getLogger(DfaMinimizer.class.getName());

    private DfaMinimizer() {}

    /**
     * Returns the minimal DFA for the given automaton, or empty when it is
     * not a valid DFA. The source automaton is not modified.
     */
    public static Optional<Automaton> minimize(Automaton dfa) {
        if (dfa.getType() != AutomatonType.DFA || !dfa.isValid()) {
            logger.fine(() -> "Cannot minimize " + dfa.getId() + ": not a valid DFA");
            return Optional.empty();
        }

        Automaton work = dfa.copy();
        removeUnreachableStates(work);

        Table table = new Table(work);
        table.fill();

        List<SortedSet<String>> classes = table.equivalenceClasses();
        Automaton result = build(work, table, classes);

        logger.fine(() -> String.format("Minimized %s: %d states -> %d states",
                                        dfa.getId(), dfa.getStateCount(), result.getStateCount()));
        return Optional.of(result);
    }

    static void removeUnreachableStates(Automaton automaton) {
        String initial = automaton.getInitialState().get().getId();
        Set<String> reachable = new HashSet<>();
        Deque<String> work = new ArrayDeque<>();
        reachable.add(initial);
        work.add(initial);
        while (!work.isEmpty()) {
            String current = work.poll();
            for (Transition t : automaton.getTransitionsFrom(current)) {
                if (reachable.add(t.getTo())) {
                    work.add(t.getTo());
                }
            }
        }

        for (State s : automaton.getStates()) {
            if (!reachable.contains(s.getId())) {
                automaton.removeState(s.getId());
            }
        }
    }

    /**
     * The distinguishability table over all state pairs, plus the implicit
     * dead state. Pairs are stored in canonical order, smaller id first.
     */
    private static final class Table {
        private final List<String> ids;
        private final Set<String> accepting;
        private final Set<String> alphabet;
        private final Map<String, Map<String, String>> delta = new HashMap<>();
        private final Set<List<String>> marked = new HashSet<>();
        private final String dead;

        Table(Automaton automaton) {
            List<String> real = new ArrayList<>();
            for (State s : automaton.getStates()) {
                real.add(s.getId());
            }
            Collections.sort(real);
            this.dead = deadId(real);
            this.ids = new ArrayList<>(real);
            this.ids.add(dead);
            this.accepting = automaton.getAcceptingStateIds();
            this.alphabet = automaton.getAlphabet();

            for (Transition t : automaton.getTransitions()) {
                Map<String, String> row = delta.computeIfAbsent(t.getFrom(), k -> new HashMap<>());
                for (String symbol : t.getSymbols()) {
                    row.put(symbol, t.getTo());
                }
            }
        }

        private static String deadId(List<String> ids) {
            String candidate = "#dead";
            while (ids.contains(candidate)) {
                candidate = "#" + candidate;
            }
            return candidate;
        }

        private String next(String state, String symbol) {
            if (state.equals(dead)) {
                return dead;
            }
            Map<String, String> row = delta.get(state);
            String to = row == null ? null : row.get(symbol);
            return to == null ? dead : to;
        }

        private static List<String> pair(String a, String b) {
            return a.compareTo(b) <= 0 ? Arrays.asList(a, b) : Arrays.asList(b, a);
        }

        boolean isDistinguishable(String a, String b) {
            return marked.contains(pair(a, b));
        }

        void fill() {
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    String a = ids.get(i), b = ids.get(j);
                    if (accepting.contains(a) != accepting.contains(b)) {
                        marked.add(pair(a, b));
                    }
                }
            }

            boolean changed;
            do {
                changed = false;
                for (int i = 0; i < ids.size(); i++) {
                    for (int j = i + 1; j < ids.size(); j++) {
                        String a = ids.get(i), b = ids.get(j);
                        if (isDistinguishable(a, b))
                            continue;
                        for (String symbol : alphabet) {
                            String na = next(a, symbol), nb = next(b, symbol);
                            if (!na.equals(nb) && isDistinguishable(na, nb)) {
                                marked.add(pair(a, b));
                                changed = true;
                                break;
                            }
                        }
                    }
                }
            } while (changed);
        }

        /**
         * Groups each unassigned state with every later unassigned state it
         * is not distinguishable from. The dead state is left out.
         */
        List<SortedSet<String>> equivalenceClasses() {
            List<SortedSet<String>> classes = new ArrayList<>();
            Set<String> assigned = new HashSet<>();
            for (String a : ids) {
                if (a.equals(dead) || assigned.contains(a))
                    continue;
                SortedSet<String> cls = new TreeSet<>();
                cls.add(a);
                assigned.add(a);
                for (String b : ids) {
                    if (!b.equals(dead) && !assigned.contains(b) && !isDistinguishable(a, b)) {
                        cls.add(b);
                        assigned.add(b);
                    }
                }
                classes.add(cls);
            }
            return classes;
        }

        String target(String state, String symbol) {
            String to = next(state, symbol);
            return to.equals(dead) ? null : to;
        }
    }

    private static Automaton build(Automaton work, Table table, List<SortedSet<String>> classes) {
        Automaton result = new Automaton(work.getId(), work.getName() + " (Minimized)", AutomatonType.DFA);
        for (String symbol : work.getAlphabet()) {
            result.addToAlphabet(symbol);
        }

        Set<String> accepting = work.getAcceptingStateIds();
        String initial = work.getInitialState().get().getId();
        Map<String, String> classOf = new HashMap<>();

        for (SortedSet<String> cls : classes) {
            String name = cls.size() == 1 ? cls.first() : "{" + String.join(",", cls) + "}";
            for (String member : cls) {
                classOf.put(member, name);
            }
            boolean isAccepting = cls.stream().anyMatch(accepting::contains);
            result.addState(new State(name, cls.contains(initial), isAccepting));
        }

        for (SortedSet<String> cls : classes) {
            String representative = cls.first();
            String from = classOf.get(representative);
            for (String symbol : work.getAlphabet()) {
                String to = table.target(representative, symbol);
                if (to != null) {
                    result.addTransition(from, classOf.get(to), symbol);
                }
            }
        }
        return result;
    }
}
