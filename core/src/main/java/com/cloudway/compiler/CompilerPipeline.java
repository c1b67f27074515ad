/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler;

import java.util.List;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.cloudway.compiler.automaton.AutomatonRegistry;
import com.cloudway.compiler.codegen.CodeGenerator;
import com.cloudway.compiler.codegen.GenerationResult;
import com.cloudway.compiler.codegen.GeneratorOptions;
import com.cloudway.compiler.codegen.TargetLanguage;
import com.cloudway.compiler.common.Config;
import com.cloudway.compiler.lexer.LexResult;
import com.cloudway.compiler.lexer.Lexer;
import com.cloudway.compiler.lexer.LexerOptions;
import com.cloudway.compiler.lexer.Token;
import com.cloudway.compiler.parser.ParseResult;
import com.cloudway.compiler.parser.Parser;
import com.cloudway.compiler.semantic.AnalysisResult;
import com.cloudway.compiler.semantic.AnalyzerOptions;
import com.cloudway.compiler.semantic.SemanticAnalyzer;

/**
 * Runs source text through every stage: tokenize, parse, analyze and
 * generate.
 *
 * <p>Lexical and parse errors are reported but do not stop the run, since
 * the parser only understands arithmetic expressions and the lexer flags
 * preprocessor lines. Code generation is withheld when the analyzer
 * reports errors, unless forced.</p>
 */
public class CompilerPipeline
{
    private static final Logger logger = Logger.getLogger(CompilerPipeline.class.getName());

    private final LexerOptions lexerOptions;
    private final AnalyzerOptions analyzerOptions;
    private final GeneratorOptions generatorOptions;

    public CompilerPipeline() {
        this(LexerOptions.defaults(), AnalyzerOptions.defaults(), GeneratorOptions.defaults());
    }

    public CompilerPipeline(LexerOptions lexerOptions, AnalyzerOptions analyzerOptions,
                            GeneratorOptions generatorOptions) {
        this.lexerOptions = requireNonNull(lexerOptions);
        this.analyzerOptions = requireNonNull(analyzerOptions);
        this.generatorOptions = requireNonNull(generatorOptions);
    }

    public static CompilerPipeline fromConfig(Config config) {
        return new CompilerPipeline(LexerOptions.fromConfig(config),
                                    AnalyzerOptions.fromConfig(config),
                                    GeneratorOptions.fromConfig(config));
    }

    public GeneratorOptions getGeneratorOptions() {
        return generatorOptions;
    }

    public Lexer newLexer() {
        return new Lexer(lexerOptions, lexerOptions.isDefaultAutomata() ? AutomatonRegistry.withDefaults() : null);
    }

    public CompilationReport compile(String source) {
        return compile(source, generatorOptions.getTarget(), false);
    }

    /**
     * Compiles the source for the given target.
     *
     * @param force generate code even if semantic analysis failed
     */
    public CompilationReport compile(String source, TargetLanguage target, boolean force) {
        requireNonNull(source);
        requireNonNull(target);

        LexResult lexed = newLexer().tokenize(source);
        List<Token> tokens = lexed.getTokens();
        ParseResult parsed = new Parser().parse(tokens);
        AnalysisResult analysis = new SemanticAnalyzer(analyzerOptions).analyze(tokens);

        GenerationResult generation = null;
        if (analysis.isSuccess() || force) {
            generation = new CodeGenerator(generatorOptions)
                .generateWithReport(tokens, analysis.getSymbolTable(), target);
        } else {
            logger.fine(() -> "Code generation withheld, " + analysis.getErrors().size() + " semantic errors");
        }

        CompilationReport report = new CompilationReport(lexed, parsed, analysis, generation);
        logger.fine(() -> "Compiled " + report);
        return report;
    }
}
