/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.semantic;

import java.util.Optional;
import static java.util.Objects.requireNonNull;

/**
 * A declared name. Symbols are mutable while the analyzer runs: the
 * value text and the initialized flag change on assignment.
 */
public class Symbol
{
    private final String name;
    private final SymbolType type;
    private String value = "";
    private int scope;
    private final int line;
    private boolean initialized;
    private boolean constant;
    private SymbolType returnType;

    public Symbol(String name, SymbolType type, int line) {
        this.name = requireNonNull(name);
        this.type = requireNonNull(type);
        this.line = line;
    }

    /**
     * Creates a function symbol. Functions count as initialized.
     */
    public static Symbol function(String name, SymbolType returnType, int line) {
        Symbol symbol = new Symbol(name, SymbolType.FUNCTION, line);
        symbol.returnType = requireNonNull(returnType);
        symbol.initialized = true;
        return symbol;
    }

    public String getName() {
        return name;
    }

    public SymbolType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = requireNonNull(value);
    }

    /**
     * Returns the depth of the scope frame the symbol was declared in,
     * 0 being the global scope.
     */
    public int getScope() {
        return scope;
    }

    void setScope(int scope) {
        this.scope = scope;
    }

    public int getLine() {
        return line;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public boolean isConstant() {
        return constant;
    }

    public void setConstant(boolean constant) {
        this.constant = constant;
    }

    public Optional<SymbolType> getReturnType() {
        return Optional.ofNullable(returnType);
    }

    /**
     * Returns the type an expression naming this symbol evaluates to.
     * A function evaluates to its return type.
     */
    public SymbolType getValueType() {
        return type == SymbolType.FUNCTION && returnType != null ? returnType : type;
    }

    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append(name).append(" : ").append(type.getName());
        if (initialized && !value.isEmpty())
            buf.append(" = ").append(value);
        if (constant)
            buf.append(" [const]");
        return buf.toString();
    }
}
