/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.semantic;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import com.cloudway.compiler.common.Config;

/**
 * Analyzer settings, read from the {@code [semantic]} configuration
 * section.
 */
public final class AnalyzerOptions
{
    private static final ImmutableSet<String> DEFAULT_BUILTINS = ImmutableSet.of(
        "cout", "cin", "endl", "std", "using", "namespace", "include",
        "printf", "scanf", "main");

    private static final AnalyzerOptions DEFAULTS = new AnalyzerOptions(DEFAULT_BUILTINS);

    private final ImmutableSet<String> builtins;

    public AnalyzerOptions(Collection<String> builtins) {
        this.builtins = ImmutableSet.copyOf(builtins);
    }

    public static AnalyzerOptions defaults() {
        return DEFAULTS;
    }

    public static AnalyzerOptions fromConfig(Config config) {
        List<String> builtins = config.getList("semantic", "builtins");
        return builtins.isEmpty() ? DEFAULTS : new AnalyzerOptions(builtins);
    }

    /**
     * Identifiers that are treated as declared without a declaration.
     */
    public Set<String> getBuiltins() {
        return builtins;
    }

    public boolean isBuiltin(String name) {
        return builtins.contains(name);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("builtins", builtins)
            .toString();
    }
}
