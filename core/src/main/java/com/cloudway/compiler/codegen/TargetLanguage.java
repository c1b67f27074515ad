/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import java.util.Locale;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

public enum TargetLanguage
{
    PYTHON("python", "#"),
    JAVA("java", "//"),
    JAVASCRIPT("javascript", "//"),
    ASSEMBLY("assembly", ";");

    private static final ImmutableMap<String, TargetLanguage> BY_NAME =
        ImmutableMap.<String, TargetLanguage>builder()
            .put("python", PYTHON)
            .put("py", PYTHON)
            .put("java", JAVA)
            .put("javascript", JAVASCRIPT)
            .put("js", JAVASCRIPT)
            .put("assembly", ASSEMBLY)
            .put("asm", ASSEMBLY)
            .build();

    private final String name;
    private final String commentPrefix;

    TargetLanguage(String name, String commentPrefix) {
        this.name = name;
        this.commentPrefix = commentPrefix;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the token that starts a line comment in this language.
     */
    public String getCommentPrefix() {
        return commentPrefix;
    }

    /**
     * Returns true if blocks are delimited by braces rather than by
     * indentation.
     */
    public boolean usesBraces() {
        return this == JAVA || this == JAVASCRIPT;
    }

    /**
     * Finds a target by name or short alias, ignoring case.
     */
    public static Optional<TargetLanguage> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public String toString() {
        return name;
    }
}
