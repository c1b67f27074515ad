/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler;

import java.util.Optional;

import com.google.common.base.MoreObjects;

import com.cloudway.compiler.codegen.GenerationResult;
import com.cloudway.compiler.lexer.LexResult;
import com.cloudway.compiler.parser.ParseResult;
import com.cloudway.compiler.semantic.AnalysisResult;

/**
 * Everything one pipeline run produced.
 */
public final class CompilationReport
{
    private final LexResult lexResult;
    private final ParseResult parseResult;
    private final AnalysisResult analysis;
    private final GenerationResult generation;

    CompilationReport(LexResult lexResult, ParseResult parseResult,
                      AnalysisResult analysis, GenerationResult generation) {
        this.lexResult = lexResult;
        this.parseResult = parseResult;
        this.analysis = analysis;
        this.generation = generation;
    }

    public LexResult getLexResult() {
        return lexResult;
    }

    public ParseResult getParseResult() {
        return parseResult;
    }

    public AnalysisResult getAnalysis() {
        return analysis;
    }

    /**
     * Returns the generated code, or empty when generation was withheld
     * because of semantic errors.
     */
    public Optional<GenerationResult> getGeneration() {
        return Optional.ofNullable(generation);
    }

    public boolean isGenerated() {
        return generation != null;
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("lexErrors", lexResult.getErrors().size())
            .add("parseErrors", parseResult.getErrors().size())
            .add("semanticErrors", analysis.getErrors().size())
            .add("warnings", analysis.getWarnings().size())
            .add("generated", isGenerated())
            .toString();
    }
}
