/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

/**
 * Why a statement could not be translated.
 */
public enum FailureKind
{
    /** A declaration or parameter has no name. */
    MISSING_IDENTIFIER,

    /** A token that cannot start or continue the statement. */
    UNEXPECTED_TOKEN,

    /** The statement ends before a required part. */
    INCOMPLETE_STATEMENT,

    /** The construct has no translation for the target. */
    UNSUPPORTED_EXPRESSION
}
