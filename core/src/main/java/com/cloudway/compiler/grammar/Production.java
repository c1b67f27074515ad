/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A grammar rule {@code lhs → rhs}. An empty right-hand side is stored as
 * the single marker {@link #EPSILON}.
 */
public final class Production
{
    public static final String EPSILON = "ε";

    private static final ImmutableSet<String> EPSILON_SPELLINGS = ImmutableSet.of(EPSILON, "epsilon", "");
    private static final Splitter ARROW = Splitter.onPattern("→|->").trimResults();
    private static final Splitter WHITESPACE = Splitter.onPattern("\\s+").trimResults().omitEmptyStrings();

    private final String lhs;
    private final ImmutableList<String> rhs;

    public Production(String lhs, List<String> rhs) {
        requireNonNull(lhs);
        requireNonNull(rhs);
        if (lhs.isEmpty()) {
            throw new IllegalArgumentException("production needs a left-hand side");
        }
        this.lhs = lhs;
        this.rhs = rhs.isEmpty() || (rhs.size() == 1 && isEpsilonSymbol(rhs.get(0)))
            ? ImmutableList.of(EPSILON)
            : ImmutableList.copyOf(rhs);
    }

    public Production(String lhs, String... rhs) {
        this(lhs, ImmutableList.copyOf(rhs));
    }

    /**
     * Parses {@code "E -> T E'"} (or with {@code →}). Right-hand symbols are
     * separated by whitespace.
     *
     * @return the production, or empty if the text has no single arrow or
     * no left-hand side
     */
    public static Optional<Production> parse(String text) {
        List<String> parts = ARROW.splitToList(text.trim());
        if (parts.size() != 2 || parts.get(0).isEmpty()) {
            return Optional.empty();
        }
        List<String> symbols = new ArrayList<>();
        WHITESPACE.split(parts.get(1)).forEach(symbols::add);
        return Optional.of(new Production(parts.get(0), symbols));
    }

    public static boolean isEpsilonSymbol(String symbol) {
        return EPSILON_SPELLINGS.contains(symbol);
    }

    public String getLhs() {
        return lhs;
    }

    public List<String> getRhs() {
        return rhs;
    }

    public boolean isEpsilon() {
        return rhs.size() == 1 && EPSILON.equals(rhs.get(0));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Production))
            return false;
        Production other = (Production)obj;
        return lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs);
    }

    public String toString() {
        return lhs + " → " + String.join(" ", rhs);
    }
}
