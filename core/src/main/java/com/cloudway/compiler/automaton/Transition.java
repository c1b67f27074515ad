/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;

/**
 * A directed edge between two states, labelled with a sorted set of
 * input symbols. The {@link #EPSILON} symbol marks an empty-string move.
 */
public class Transition
{
    public static final String EPSILON = "ε";

    private static final ImmutableSet<String> EPSILON_SPELLINGS =
        ImmutableSet.of(EPSILON, "epsilon", "");

    private final String from;
    private final String to;
    private final SortedSet<String> symbols = new TreeSet<>();

    public Transition(String from, String to, String symbol) {
        this(from, to, Collections.singleton(symbol));
    }

    public Transition(String from, String to, Collection<String> symbols) {
        this.from = requireNonNull(from);
        this.to = requireNonNull(to);
        for (String s : symbols) {
            this.symbols.add(normalize(s));
        }
    }

    /**
     * Maps the accepted spellings of epsilon to {@link #EPSILON}, returning
     * any other symbol unchanged. A null symbol is treated as epsilon.
     */
    public static String normalize(String symbol) {
        return isEpsilonSymbol(symbol) ? EPSILON : symbol;
    }

    public static boolean isEpsilonSymbol(String symbol) {
        return symbol == null || EPSILON_SPELLINGS.contains(symbol);
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public SortedSet<String> getSymbols() {
        return Collections.unmodifiableSortedSet(symbols);
    }

    public boolean hasSymbol(String symbol) {
        return symbols.contains(normalize(symbol));
    }

    public boolean isEpsilon() {
        return symbols.contains(EPSILON);
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    void addSymbols(Collection<String> more) {
        symbols.addAll(more);
    }

    boolean removeSymbol(String symbol) {
        return symbols.remove(normalize(symbol));
    }

    boolean connects(String from, String to) {
        return this.from.equals(from) && this.to.equals(to);
    }

    boolean touches(String stateId) {
        return from.equals(stateId) || to.equals(stateId);
    }

    Transition copy() {
        return new Transition(from, to, symbols);
    }

    /**
     * Returns the symbols joined with commas, as shown on an edge label.
     */
    public String getSymbolsString() {
        return String.join(",", symbols);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Transition))
            return false;
        Transition other = (Transition)obj;
        return from.equals(other.from) && to.equals(other.to) && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, symbols);
    }

    public String toString() {
        return from + " --" + getSymbolsString() + "--> " + to;
    }
}
