/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import com.google.common.base.MoreObjects;

import com.cloudway.compiler.common.Config;

/**
 * Lexer switches, read from the {@code [lexer]} configuration section.
 */
public final class LexerOptions
{
    private static final LexerOptions DEFAULTS = new LexerOptions(true, true, true);

    private final boolean skipWhitespace;
    private final boolean skipComments;
    private final boolean defaultAutomata;

    public LexerOptions(boolean skipWhitespace, boolean skipComments, boolean defaultAutomata) {
        this.skipWhitespace = skipWhitespace;
        this.skipComments = skipComments;
        this.defaultAutomata = defaultAutomata;
    }

    public static LexerOptions defaults() {
        return DEFAULTS;
    }

    public static LexerOptions fromConfig(Config config) {
        return new LexerOptions(
            config.getBoolean("lexer", "skipWhitespace", DEFAULTS.skipWhitespace),
            config.getBoolean("lexer", "skipComments", DEFAULTS.skipComments),
            config.getBoolean("lexer", "defaultAutomata", DEFAULTS.defaultAutomata));
    }

    public boolean isSkipWhitespace() {
        return skipWhitespace;
    }

    public boolean isSkipComments() {
        return skipComments;
    }

    /**
     * Whether the default identifier and number automata back the
     * lexer's fallback matching.
     */
    public boolean isDefaultAutomata() {
        return defaultAutomata;
    }

    public LexerOptions withSkipWhitespace(boolean skip) {
        return new LexerOptions(skip, skipComments, defaultAutomata);
    }

    public LexerOptions withSkipComments(boolean skip) {
        return new LexerOptions(skipWhitespace, skip, defaultAutomata);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("skipWhitespace", skipWhitespace)
            .add("skipComments", skipComments)
            .add("defaultAutomata", defaultAutomata)
            .toString();
    }
}
