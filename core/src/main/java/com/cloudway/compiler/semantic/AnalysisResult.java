/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.semantic;

import java.util.List;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of one analyzer pass. The pass succeeds if it reported no
 * errors; warnings do not count.
 */
public final class AnalysisResult
{
    private final SymbolTable symbolTable;
    private final ImmutableList<SemanticError> errors;
    private final ImmutableList<SemanticError> warnings;

    public AnalysisResult(SymbolTable symbolTable, List<SemanticError> errors, List<SemanticError> warnings) {
        this.symbolTable = requireNonNull(symbolTable);
        this.errors = ImmutableList.copyOf(errors);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /**
     * Returns the symbol table as left by the pass. Only the global scope
     * is still populated.
     */
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public List<Symbol> getDiscoveredSymbols() {
        return symbolTable.getDiscoveredSymbols();
    }

    public List<SemanticError> getErrors() {
        return errors;
    }

    public List<SemanticError> getWarnings() {
        return warnings;
    }

    /**
     * Returns errors followed by warnings, one per line.
     */
    public String formatDiagnostics() {
        StringBuilder buf = new StringBuilder();
        errors.forEach(e -> buf.append("Error: ").append(e).append('\n'));
        warnings.forEach(w -> buf.append("Warning: ").append(w).append('\n'));
        return buf.toString();
    }
}
