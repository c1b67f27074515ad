/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.semantic;

import java.util.Locale;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;

/**
 * The value types known to the analyzer.
 */
public enum SymbolType
{
    INTEGER("int"),
    FLOAT("float"),
    DOUBLE("double"),
    CHAR("char"),
    STRING("string"),
    BOOLEAN("bool"),
    VOID("void"),
    FUNCTION("function"),
    UNKNOWN("unknown");

    private static final ImmutableMap<String, SymbolType> BY_NAME =
        ImmutableMap.<String, SymbolType>builder()
            .put("int", INTEGER)
            .put("integer", INTEGER)
            .put("float", FLOAT)
            .put("double", DOUBLE)
            .put("char", CHAR)
            .put("string", STRING)
            .put("bool", BOOLEAN)
            .put("boolean", BOOLEAN)
            .put("void", VOID)
            .build();

    // target type -> source types that widen to it implicitly
    private static final ImmutableSetMultimap<SymbolType, SymbolType> WIDENING =
        ImmutableSetMultimap.<SymbolType, SymbolType>builder()
            .put(FLOAT, INTEGER)
            .put(DOUBLE, INTEGER)
            .put(DOUBLE, FLOAT)
            .put(STRING, CHAR)
            .build();

    private final String name;

    SymbolType(String name) {
        this.name = name;
    }

    /**
     * Returns the source-level spelling of this type.
     */
    public String getName() {
        return name;
    }

    /**
     * Maps a type keyword to its type, ignoring case. Unrecognized
     * spellings map to {@link #UNKNOWN}.
     */
    public static SymbolType fromName(String name) {
        SymbolType type = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        return type != null ? type : UNKNOWN;
    }

    /**
     * Returns true if a value of the given type may be stored in a
     * variable of this type.
     */
    public boolean accepts(SymbolType actual) {
        return this == actual || WIDENING.containsEntry(this, actual);
    }

    public String toString() {
        return name;
    }
}
