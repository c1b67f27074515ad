/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * A stack of scope frames. Frame 0 is the global scope and is never
 * popped. Besides the live frames the table keeps a log of every symbol
 * ever declared, in declaration order, so symbols of closed scopes can
 * still be inspected after the pass.
 */
public class SymbolTable
{
    private final List<Map<String, Symbol>> frames = new ArrayList<>();
    private final List<Symbol> discovered = new ArrayList<>();
    private int currentScope;

    public SymbolTable() {
        frames.add(new TreeMap<>());
    }

    public int getCurrentScope() {
        return currentScope;
    }

    /**
     * Opens a nested scope, reusing the frame left behind by an earlier
     * scope at the same depth.
     */
    public void enterScope() {
        currentScope++;
        if (currentScope >= frames.size()) {
            frames.add(new TreeMap<>());
        }
    }

    /**
     * Discards the symbols of the current scope and returns to the
     * enclosing one. Does nothing at the global scope.
     */
    public void exitScope() {
        if (currentScope > 0) {
            frames.get(currentScope).clear();
            currentScope--;
        }
    }

    /**
     * Declares a symbol in the current scope.
     *
     * @return false if the name is already declared in the current scope
     */
    public boolean declare(Symbol symbol) {
        requireNonNull(symbol);
        if (existsInCurrentScope(symbol.getName())) {
            return false;
        }
        symbol.setScope(currentScope);
        frames.get(currentScope).put(symbol.getName(), symbol);
        discovered.add(symbol);
        return true;
    }

    /**
     * Finds the innermost visible symbol with the given name.
     */
    public Optional<Symbol> lookup(String name) {
        for (int i = currentScope; i >= 0; i--) {
            Symbol symbol = frames.get(i).get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    public boolean exists(String name) {
        return lookup(name).isPresent();
    }

    public boolean existsInCurrentScope(String name) {
        return frames.get(currentScope).containsKey(name);
    }

    /**
     * Records a new value for the innermost visible symbol and marks it
     * initialized.
     *
     * @return false if no such symbol is visible
     */
    public boolean update(String name, String value) {
        Optional<Symbol> symbol = lookup(name);
        symbol.ifPresent(s -> {
            s.setValue(value);
            s.setInitialized(true);
        });
        return symbol.isPresent();
    }

    /**
     * Returns every symbol ever declared, oldest first.
     */
    public List<Symbol> getDiscoveredSymbols() {
        return ImmutableList.copyOf(discovered);
    }

    /**
     * Returns the symbols of a live scope frame, ordered by name.
     */
    public List<Symbol> getSymbolsInScope(int scope) {
        if (scope < 0 || scope >= frames.size())
            return ImmutableList.of();
        return ImmutableList.copyOf(frames.get(scope).values());
    }

    public void clear() {
        frames.clear();
        frames.add(new TreeMap<>());
        discovered.clear();
        currentScope = 0;
    }

    public String render() {
        StringBuilder buf = new StringBuilder("Symbol Table:\n\n");
        for (int i = 0; i <= currentScope; i++) {
            buf.append("Scope ").append(i).append(":\n");
            Map<String, Symbol> frame = frames.get(i);
            if (frame.isEmpty()) {
                buf.append("  (empty)\n");
            } else {
                frame.values().forEach(s -> buf.append("  ").append(s).append('\n'));
            }
            buf.append('\n');
        }
        return buf.toString();
    }

    public String toString() {
        return render();
    }
}
