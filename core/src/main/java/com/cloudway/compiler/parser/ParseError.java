/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.parser;

import static java.util.Objects.requireNonNull;

public final class ParseError
{
    private final String message;
    private final int position;
    private final String expected;
    private final String found;

    public ParseError(String message, int position, String expected, String found) {
        this.message = requireNonNull(message);
        this.position = position;
        this.expected = requireNonNull(expected);
        this.found = requireNonNull(found);
    }

    public String getMessage() {
        return message;
    }

    /**
     * Returns the index of the offending token in the token stream.
     */
    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public String toString() {
        return String.format("Parse Error at position %d: %s\nExpected: %s\nFound: %s",
                             position, message, expected, found);
    }
}
