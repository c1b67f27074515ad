/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import java.util.Locale;

import com.google.common.collect.ImmutableSet;

/**
 * The reserved words of the source language. Matching ignores case.
 */
public final class Keywords
{
    private Keywords() {}

    private static final ImmutableSet<String> KEYWORDS = ImmutableSet.of(
        "if", "else", "while", "for", "do", "switch", "case", "default",
        "break", "continue", "return", "void", "int", "float", "double",
        "char", "bool", "true", "false", "const", "static", "class",
        "public", "private", "protected", "struct", "enum", "string");

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    public static TokenType classify(String word) {
        return isKeyword(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
    }

    public static ImmutableSet<String> all() {
        return KEYWORDS;
    }
}
