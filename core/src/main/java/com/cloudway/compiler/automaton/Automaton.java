/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.cloudway.compiler.automaton.TransitionCheck.Violation;

/**
 * A finite automaton built incrementally from states and transitions.
 *
 * <p>A DFA-typed automaton never holds an epsilon transition nor two
 * transitions from the same state on the same symbol: mutations that
 * would break this are rejected with a {@link TransitionCheck}.</p>
 */
public class Automaton
{
    private static final Logger logger = Logger.getLogger(Automaton.class.getName());

    private final String id;
    private String name;
    private AutomatonType type;

    private final Map<String, State> states = new LinkedHashMap<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final SortedSet<String> alphabet = new TreeSet<>();
    private String initialStateId;

    // DFA transition table, rebuilt lazily after the transitions change
    private Map<String, Map<String, String>> delta;

    public Automaton(String id, String name, AutomatonType type) {
        this.id = requireNonNull(id);
        this.name = requireNonNull(name);
        this.type = requireNonNull(type);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = requireNonNull(name);
    }

    public AutomatonType getType() {
        return type;
    }

    /**
     * Changes the automaton type. Switching to {@code DFA} is refused while
     * the current transitions are not deterministic.
     *
     * @return true if the type was changed
     */
    public boolean setType(AutomatonType type) {
        requireNonNull(type);
        if (type == AutomatonType.DFA && this.type != AutomatonType.DFA && isNondeterministic()) {
            logger.fine(() -> "Refused to retype " + id + " as DFA: transitions are nondeterministic");
            return false;
        }
        this.type = type;
        return true;
    }

    // States

    /**
     * Adds a state. An initial state replaces any previous initial state.
     *
     * @return false if a state with the same id already exists
     */
    public boolean addState(State state) {
        requireNonNull(state);
        if (states.containsKey(state.getId())) {
            logger.fine(() -> "Duplicate state " + state.getId() + " in " + id);
            return false;
        }
        states.put(state.getId(), state);
        if (state.isInitial()) {
            setInitialState(state.getId());
        }
        return true;
    }

    /**
     * Removes a state together with every transition entering or leaving it.
     *
     * @return false if there is no such state
     */
    public boolean removeState(String stateId) {
        if (states.remove(stateId) == null) {
            return false;
        }
        transitions.removeIf(t -> t.touches(stateId));
        delta = null;
        if (stateId.equals(initialStateId)) {
            initialStateId = null;
        }
        return true;
    }

    public Optional<State> getState(String stateId) {
        return Optional.ofNullable(states.get(stateId));
    }

    public boolean hasState(String stateId) {
        return states.containsKey(stateId);
    }

    public List<State> getStates() {
        return ImmutableList.copyOf(states.values());
    }

    public int getStateCount() {
        return states.size();
    }

    /**
     * Makes the given state the only initial state.
     *
     * @return false if there is no such state
     */
    public boolean setInitialState(String stateId) {
        State target = states.get(stateId);
        if (target == null) {
            return false;
        }
        for (State s : states.values()) {
            s.setInitial(false);
        }
        target.setInitial(true);
        initialStateId = stateId;
        return true;
    }

    public Optional<State> getInitialState() {
        return initialStateId == null ? Optional.empty() : getState(initialStateId);
    }

    public Set<String> getAcceptingStateIds() {
        return states.values().stream()
            .filter(State::isAccepting)
            .map(State::getId)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    // Transitions

    /**
     * Checks whether a transition could be added without breaking the
     * structural rules of this automaton.
     */
    public TransitionCheck canAddTransition(Transition t) {
        requireNonNull(t);
        if (t.isEmpty()) {
            return TransitionCheck.rejected(Violation.EMPTY_SYMBOLS,
                "Transition " + t.getFrom() + " -> " + t.getTo() + " has no symbols");
        }
        if (!states.containsKey(t.getFrom())) {
            return TransitionCheck.rejected(Violation.MISSING_STATE,
                "Source state '" + t.getFrom() + "' does not exist");
        }
        if (!states.containsKey(t.getTo())) {
            return TransitionCheck.rejected(Violation.MISSING_STATE,
                "Destination state '" + t.getTo() + "' does not exist");
        }

        if (type == AutomatonType.DFA) {
            if (t.isEpsilon()) {
                return TransitionCheck.rejected(Violation.EPSILON_IN_DFA,
                    "DFA cannot have epsilon transitions");
            }
            for (Transition existing : transitions) {
                if (!existing.getFrom().equals(t.getFrom()))
                    continue;
                for (String symbol : t.getSymbols()) {
                    if (existing.hasSymbol(symbol)) {
                        return TransitionCheck.rejected(Violation.NONDETERMINISTIC,
                            "DFA state '" + t.getFrom() + "' already has a transition on '" + symbol + "'");
                    }
                }
            }
        }
        return TransitionCheck.accepted();
    }

    /**
     * Adds a transition. Symbols are merged into an existing edge between the
     * same pair of states instead of creating a parallel edge.
     */
    public TransitionCheck addTransition(Transition t) {
        TransitionCheck check = canAddTransition(t);
        if (!check.isAccepted()) {
            logger.fine(() -> "Rejected transition " + t + " in " + id + ": " + check);
            return check;
        }

        delta = null;
        Optional<Transition> existing = getTransition(t.getFrom(), t.getTo());
        if (existing.isPresent()) {
            existing.get().addSymbols(t.getSymbols());
        } else {
            transitions.add(t.copy());
        }
        for (String symbol : t.getSymbols()) {
            if (!Transition.EPSILON.equals(symbol)) {
                alphabet.add(symbol);
            }
        }
        return check;
    }

    public TransitionCheck addTransition(String from, String to, String symbol) {
        return addTransition(new Transition(from, to, symbol));
    }

    /**
     * Removes one symbol from the edge between two states, or the whole
     * edge when {@code symbol} is null. An edge left without symbols is
     * deleted.
     *
     * @return false if nothing was removed
     */
    public boolean removeTransition(String from, String to, String symbol) {
        for (Iterator<Transition> it = transitions.iterator(); it.hasNext(); ) {
            Transition t = it.next();
            if (!t.connects(from, to))
                continue;
            delta = null;
            if (symbol == null) {
                it.remove();
                return true;
            }
            boolean removed = t.removeSymbol(symbol);
            if (t.isEmpty()) {
                it.remove();
            }
            return removed;
        }
        return false;
    }

    public Optional<Transition> getTransition(String from, String to) {
        return transitions.stream().filter(t -> t.connects(from, to)).findFirst();
    }

    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public List<Transition> getTransitionsFrom(String stateId) {
        return transitions.stream()
            .filter(t -> t.getFrom().equals(stateId))
            .collect(Collectors.toList());
    }

    public int getTransitionCount() {
        return transitions.size();
    }

    // Alphabet

    public SortedSet<String> getAlphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    /**
     * Adds a symbol to the alphabet. Epsilon spellings are ignored.
     */
    public void addToAlphabet(String symbol) {
        if (!Transition.isEpsilonSymbol(symbol)) {
            alphabet.add(symbol);
        }
    }

    // Simulation

    /**
     * An automaton is valid when it has states and its initial state exists.
     */
    public boolean isValid() {
        return !states.isEmpty() && initialStateId != null && states.containsKey(initialStateId);
    }

    /**
     * Returns every state reachable from the given states through zero or
     * more epsilon transitions. Unknown ids are carried through unchanged.
     */
    public Set<String> epsilonClosure(Set<String> stateIds) {
        Set<String> closure = new TreeSet<>(stateIds);
        Deque<String> work = new ArrayDeque<>(stateIds);
        while (!work.isEmpty()) {
            String current = work.pop();
            for (Transition t : transitions) {
                if (t.isEpsilon() && t.getFrom().equals(current) && closure.add(t.getTo())) {
                    work.push(t.getTo());
                }
            }
        }
        return closure;
    }

    /**
     * Returns the states reached from any of the given states by one
     * transition on {@code symbol}, without epsilon closure.
     */
    public Set<String> move(Set<String> stateIds, String symbol) {
        Set<String> result = new TreeSet<>();
        if (Transition.EPSILON.equals(symbol)) {
            return result;
        }
        for (Transition t : transitions) {
            if (stateIds.contains(t.getFrom()) && t.getSymbols().contains(symbol)) {
                result.add(t.getTo());
            }
        }
        return result;
    }

    /**
     * Runs the automaton over the input, one character per symbol.
     */
    public boolean accepts(String input) {
        requireNonNull(input);
        if (!isValid()) {
            return false;
        }
        return type == AutomatonType.DFA ? simulateDfa(input) : simulateNfa(input);
    }

    private boolean simulateDfa(String input) {
        Map<String, Map<String, String>> table = transitionTable();
        String current = initialStateId;
        for (int i = 0; i < input.length(); i++) {
            current = step(table, current, input.charAt(i));
            if (current == null) {
                return false;
            }
        }
        return states.get(current).isAccepting();
    }

    private Map<String, Map<String, String>> transitionTable() {
        if (delta == null) {
            Map<String, Map<String, String>> table = new HashMap<>();
            for (Transition t : transitions) {
                Map<String, String> row = table.computeIfAbsent(t.getFrom(), k -> new HashMap<>());
                for (String symbol : t.getSymbols()) {
                    row.put(symbol, t.getTo());
                }
            }
            delta = table;
        }
        return delta;
    }

    private static String step(Map<String, Map<String, String>> table, String current, char c) {
        Map<String, String> row = table.get(current);
        return row == null ? null : row.get(String.valueOf(c));
    }

    /**
     * Runs the automaton over the input from {@code start} and returns the
     * length of the longest non-empty accepted prefix, or 0 when there is
     * none. Scanning stops as soon as no state is live.
     */
    public int longestAcceptedPrefix(CharSequence input, int start) {
        requireNonNull(input);
        if (!isValid()) {
            return 0;
        }
        int longest = 0;
        if (type == AutomatonType.DFA) {
            Map<String, Map<String, String>> table = transitionTable();
            String current = initialStateId;
            for (int i = start; i < input.length(); i++) {
                current = step(table, current, input.charAt(i));
                if (current == null)
                    break;
                if (states.get(current).isAccepting())
                    longest = i - start + 1;
            }
        } else {
            Set<String> active = epsilonClosure(Collections.singleton(initialStateId));
            for (int i = start; i < input.length(); i++) {
                active = epsilonClosure(move(active, String.valueOf(input.charAt(i))));
                if (active.isEmpty())
                    break;
                if (active.stream().map(states::get).anyMatch(s -> s != null && s.isAccepting()))
                    longest = i - start + 1;
            }
        }
        return longest;
    }

    private boolean simulateNfa(String input) {
        Set<String> active = epsilonClosure(Collections.singleton(initialStateId));
        for (int i = 0; i < input.length(); i++) {
            active = epsilonClosure(move(active, String.valueOf(input.charAt(i))));
            if (active.isEmpty()) {
                return false;
            }
        }
        return active.stream().map(states::get).anyMatch(s -> s != null && s.isAccepting());
    }

    /**
     * Classifies the automaton by its transitions and records the result
     * as its type.
     */
    public AutomatonType detectType() {
        type = isNondeterministic() ? AutomatonType.NFA : AutomatonType.DFA;
        return type;
    }

    private boolean isNondeterministic() {
        Map<String, Set<String>> seen = new HashMap<>();
        for (Transition t : transitions) {
            if (t.isEpsilon()) {
                return true;
            }
            Set<String> symbols = seen.computeIfAbsent(t.getFrom(), k -> new TreeSet<>());
            for (String symbol : t.getSymbols()) {
                if (!symbols.add(symbol)) {
                    return true;
                }
            }
        }
        return false;
    }

    // Housekeeping

    /**
     * Returns a deep copy of this automaton under the same id and name.
     */
    public Automaton copy() {
        Automaton copy = new Automaton(id, name, type);
        for (State s : states.values()) {
            copy.states.put(s.getId(), s.copy());
        }
        for (Transition t : transitions) {
            copy.transitions.add(t.copy());
        }
        copy.alphabet.addAll(alphabet);
        copy.initialStateId = initialStateId;
        return copy;
    }

    public void clear() {
        states.clear();
        transitions.clear();
        alphabet.clear();
        initialStateId = null;
        delta = null;
    }

    /**
     * Returns a multi-line listing of the automaton. Initial states are
     * marked with {@code ->} and accepting states with {@code *}.
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        out.append(name).append(" [").append(id).append("] (").append(type).append(")\n");
        out.append("Alphabet: {").append(String.join(", ", alphabet)).append("}\n");
        out.append("States:\n");
        for (State s : states.values()) {
            out.append(s.isInitial() ? "  ->" : "    ")
               .append(s.isAccepting() ? "* " : "  ")
               .append(s.getId());
            if (!s.getLabel().equals(s.getId())) {
                out.append(" (").append(s.getLabel()).append(")");
            }
            out.append('\n');
        }
        out.append("Transitions:\n");
        for (Transition t : transitions) {
            out.append("  ").append(t).append('\n');
        }
        return out.toString();
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("name", name)
            .add("type", type)
            .add("states", states.size())
            .add("transitions", transitions.size())
            .toString();
    }
}
