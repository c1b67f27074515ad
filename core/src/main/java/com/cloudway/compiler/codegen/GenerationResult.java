/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import java.util.List;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * Generated text together with the statements that had to be skipped.
 */
public final class GenerationResult
{
    private final TargetLanguage target;
    private final String code;
    private final ImmutableList<StatementResult> skipped;

    public GenerationResult(TargetLanguage target, String code, List<StatementResult> skipped) {
        this.target = requireNonNull(target);
        this.code = requireNonNull(code);
        this.skipped = ImmutableList.copyOf(skipped);
    }

    public TargetLanguage getTarget() {
        return target;
    }

    public String getCode() {
        return code;
    }

    public List<StatementResult> getSkipped() {
        return skipped;
    }

    public boolean isComplete() {
        return skipped.isEmpty();
    }

    public String toString() {
        return code;
    }
}
