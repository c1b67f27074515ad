/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.automaton;

import java.util.Optional;

/**
 * Read-only view of a set of automata, used to recognize text that no
 * hand-written lexical rule covers.
 */
public interface AutomatonMatcher
{
    /**
     * Returns the id of the first automaton that accepts the text.
     */
    Optional<String> findMatchingAutomaton(String text);

    /**
     * Finds the longest non-empty prefix of {@code input} starting at
     * {@code start} that some automaton accepts. When several automata
     * accept it the first one wins.
     */
    Optional<AutomatonMatch> findLongestMatch(CharSequence input, int start);
}
