/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import static java.util.Objects.requireNonNull;

/**
 * A context-free grammar description. Symbols are classified as they are
 * added: a symbol starting with an uppercase letter is a non-terminal,
 * anything else a terminal, and a left-hand side is always a non-terminal.
 *
 * <p>The grammar names the parse tree built by the expression parser; it
 * does not drive parsing.</p>
 */
public class Grammar
{
    private final String name;
    private final String startSymbol;
    private final List<Production> productions = new ArrayList<>();
    private final Set<String> terminals = new LinkedHashSet<>();
    private final Set<String> nonTerminals = new LinkedHashSet<>();

    public Grammar(String name, String startSymbol) {
        this.name = requireNonNull(name);
        this.startSymbol = requireNonNull(startSymbol);
    }

    public String getName() {
        return name;
    }

    public String getStartSymbol() {
        return startSymbol;
    }

    public void addProduction(Production production) {
        productions.add(requireNonNull(production));
        classify(production);
    }

    public Grammar add(String lhs, String... rhs) {
        addProduction(new Production(lhs, rhs));
        return this;
    }

    /**
     * Removes the production at the given index. Symbols used only by that
     * production are dropped from the symbol sets.
     *
     * @return false if the index is out of range
     */
    public boolean removeProduction(int index) {
        if (index < 0 || index >= productions.size()) {
            return false;
        }
        productions.remove(index);
        terminals.clear();
        nonTerminals.clear();
        productions.forEach(this::classify);
        return true;
    }

    public void clear() {
        productions.clear();
        terminals.clear();
        nonTerminals.clear();
    }

    private void classify(Production p) {
        nonTerminals.add(p.getLhs());
        terminals.remove(p.getLhs());
        for (String symbol : p.getRhs()) {
            if (Production.isEpsilonSymbol(symbol))
                continue;
            if (isNonTerminalName(symbol)) {
                nonTerminals.add(symbol);
            } else if (!nonTerminals.contains(symbol)) {
                terminals.add(symbol);
            }
        }
    }

    static boolean isNonTerminalName(String symbol) {
        return Character.isUpperCase(symbol.charAt(0));
    }

    public List<Production> getProductions() {
        return Collections.unmodifiableList(productions);
    }

    public List<Production> getProductionsFor(String nonTerminal) {
        return productions.stream()
            .filter(p -> p.getLhs().equals(nonTerminal))
            .collect(Collectors.toList());
    }

    public Set<String> getTerminals() {
        return Collections.unmodifiableSet(terminals);
    }

    public Set<String> getNonTerminals() {
        return Collections.unmodifiableSet(nonTerminals);
    }

    public boolean isTerminal(String symbol) {
        return terminals.contains(symbol);
    }

    public boolean isNonTerminal(String symbol) {
        return nonTerminals.contains(symbol);
    }

    public String toString() {
        StringBuilder out = new StringBuilder();
        out.append("Grammar: ").append(name).append('\n');
        out.append("Start Symbol: ").append(startSymbol).append("\n\n");
        out.append("Productions:\n");
        for (Production p : productions) {
            out.append("  ").append(p).append('\n');
        }
        return out.toString();
    }

    // Presets

    /**
     * The left-recursive arithmetic grammar.
     */
    public static Grammar arithmetic() {
        return new Grammar("Arithmetic Expression Grammar", "E")
            .add("E", "E", "+", "T")
            .add("E", "E", "-", "T")
            .add("E", "T")
            .add("T", "T", "*", "F")
            .add("T", "T", "/", "F")
            .add("T", "F")
            .add("F", "(", "E", ")")
            .add("F", "id")
            .add("F", "num");
    }

    public static Grammar simpleStatement() {
        return new Grammar("Simple Statement Grammar", "S")
            .add("S", "if", "E", "then", "S", "else", "S")
            .add("S", "while", "E", "do", "S")
            .add("S", "id", "=", "E")
            .add("S", ";")
            .add("E", "E", "+", "E")
            .add("E", "E", "*", "E")
            .add("E", "(", "E", ")")
            .add("E", "id")
            .add("E", "num");
    }

    /**
     * The LL(1) expression grammar recognized by the expression parser.
     */
    public static Grammar expression() {
        return new Grammar("Expression Grammar (LL)", "E")
            .add("E", "T", "E'")
            .add("E'", "+", "T", "E'")
            .add("E'", Production.EPSILON)
            .add("T", "F", "T'")
            .add("T'", "*", "F", "T'")
            .add("T'", Production.EPSILON)
            .add("F", "(", "E", ")")
            .add("F", "id")
            .add("F", "num");
    }
}
