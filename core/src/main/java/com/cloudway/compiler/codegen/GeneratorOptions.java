/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import com.cloudway.compiler.common.Config;

/**
 * Code generator settings, read from the {@code [codegen]} configuration
 * section.
 */
public final class GeneratorOptions
{
    private static final GeneratorOptions DEFAULTS = new GeneratorOptions(TargetLanguage.PYTHON, false, 4);

    private final TargetLanguage target;
    private final boolean preamble;
    private final int indent;

    public GeneratorOptions(TargetLanguage target, boolean preamble, int indent) {
        if (indent < 0)
            throw new IllegalArgumentException("negative indent: " + indent);
        this.target = requireNonNull(target);
        this.preamble = preamble;
        this.indent = indent;
    }

    public static GeneratorOptions defaults() {
        return DEFAULTS;
    }

    public static GeneratorOptions fromConfig(Config config) {
        TargetLanguage target = config.get("codegen", "target")
            .flatMap(TargetLanguage::fromName)
            .orElse(DEFAULTS.target);
        return new GeneratorOptions(target,
                                    config.getBoolean("codegen", "preamble", DEFAULTS.preamble),
                                    Math.max(0, config.getInt("codegen", "indent", DEFAULTS.indent)));
    }

    public TargetLanguage getTarget() {
        return target;
    }

    /**
     * Whether to emit the file header, and for Java the class wrapper.
     */
    public boolean isPreamble() {
        return preamble;
    }

    /**
     * Spaces per nesting level.
     */
    public int getIndent() {
        return indent;
    }

    public GeneratorOptions withTarget(TargetLanguage target) {
        return new GeneratorOptions(target, preamble, indent);
    }

    public GeneratorOptions withPreamble(boolean preamble) {
        return new GeneratorOptions(target, preamble, indent);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("target", target)
            .add("preamble", preamble)
            .add("indent", indent)
            .toString();
    }
}
