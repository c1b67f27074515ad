/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.cloudway.compiler.codegen.GeneratorOptions;
import com.cloudway.compiler.codegen.TargetLanguage;
import com.cloudway.compiler.lexer.LexerOptions;
import com.cloudway.compiler.semantic.AnalyzerOptions;

public class CompilerPipelineTest
{
    @Test
    public void cleanProgramIsGenerated() {
        CompilationReport report = new CompilerPipeline().compile("int x = 5;\nx = x + 1;\n");

        assertTrue(report.getLexResult().isSuccess());
        assertTrue(report.getAnalysis().isSuccess());
        assertTrue(report.isGenerated());
        assertEquals("x = 5\nx = x + 1\n", report.getGeneration().get().getCode());
    }

    @Test
    public void semanticErrorsWithholdGeneration() {
        CompilationReport report = new CompilerPipeline().compile("y = 1;", TargetLanguage.JAVA, false);

        assertFalse(report.getAnalysis().isSuccess());
        assertFalse(report.isGenerated());
        assertFalse(report.getGeneration().isPresent());
    }

    @Test
    public void forcedGenerationIgnoresSemanticErrors() {
        CompilationReport report = new CompilerPipeline().compile("y = 1;", TargetLanguage.JAVA, true);

        assertThat(report.getAnalysis().getErrors().size(), is(1));
        assertEquals("y = 1;\n", report.getGeneration().get().getCode());
    }

    @Test
    public void lexicalErrorsDoNotStopGeneration() {
        CompilationReport report = new CompilerPipeline().compile("#include <iostream>\nint n = 2;\n");

        assertFalse(report.getLexResult().isSuccess());
        assertTrue(report.isGenerated());
        assertThat(report.getGeneration().get().getCode(), containsString("n = 2\n"));
    }

    @Test
    public void expressionsAreParsed() {
        CompilationReport report = new CompilerPipeline().compile("a + b * 2");

        assertTrue(report.getParseResult().isSuccess());
        assertFalse(report.getParseResult().getTree().isEmpty());
    }

    @Test
    public void generatorOptionsApply() {
        CompilerPipeline pipeline = new CompilerPipeline(
            LexerOptions.defaults(), AnalyzerOptions.defaults(),
            GeneratorOptions.defaults().withTarget(TargetLanguage.JAVASCRIPT));

        assertEquals("let x = 1;\n", pipeline.compile("int x = 1;").getGeneration().get().getCode());
    }
}
