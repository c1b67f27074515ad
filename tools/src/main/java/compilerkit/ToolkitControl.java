/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package compilerkit;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.google.common.io.Files;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

import com.cloudway.compiler.CompilationReport;
import com.cloudway.compiler.CompilerPipeline;
import com.cloudway.compiler.automaton.Automaton;
import com.cloudway.compiler.automaton.AutomatonRegistry;
import com.cloudway.compiler.automaton.DfaMinimizer;
import com.cloudway.compiler.automaton.NfaToDfa;
import com.cloudway.compiler.codegen.GenerationResult;
import com.cloudway.compiler.codegen.GeneratorOptions;
import com.cloudway.compiler.codegen.TargetLanguage;
import com.cloudway.compiler.common.Config;
import com.cloudway.compiler.lexer.LexResult;
import com.cloudway.compiler.lexer.LexerOptions;
import com.cloudway.compiler.parser.ParseResult;
import com.cloudway.compiler.parser.Parser;
import com.cloudway.compiler.semantic.AnalysisResult;
import com.cloudway.compiler.semantic.AnalyzerOptions;

public class ToolkitControl extends Control
{
    private static final String LOGGER_ROOT = "com.cloudway.compiler";

    // held here so the level set by -v is not lost with a collected logger
    private static final Logger rootLogger = Logger.getLogger(LOGGER_ROOT);

    public ToolkitControl() {
        this(System.out, System.err);
    }

    public ToolkitControl(PrintStream out, PrintStream err) {
        super(out, err);
    }

    @SuppressWarnings("all")
    private static Option[] VERBOSE_OPTIONS = {
        OptionBuilder.withDescription("Log every stage to the console")
                     .create('v')
    };

    @SuppressWarnings("all")
    private static Option[] COMMON_OPTIONS = {
        OptionBuilder.withArgName("file")
                     .withDescription("Configuration file")
                     .hasArg()
                     .create('c'),
        VERBOSE_OPTIONS[0]
    };

    @SuppressWarnings("all")
    private static Option[] GENERATE_OPTIONS = {
        OptionBuilder.withArgName("target")
                     .withDescription("Target language (python,java,javascript,assembly)")
                     .hasArg()
                     .create('t'),
        OptionBuilder.withDescription("Emit the file header and class wrapper")
                     .create('p'),
        OptionBuilder.withDescription("Generate even if semantic analysis fails")
                     .create('f')
    };

    @Command("Print the token stream of a source file")
    public void tokenize(String[] args) throws IOException {
        CommandLine cmd = parseArgs("tokenize [-c file] [-v] FILE", args, 1, 1, COMMON_OPTIONS);
        CompilerPipeline pipeline = CompilerPipeline.fromConfig(config(cmd));

        LexResult result = pipeline.newLexer().tokenize(read(cmd.getArgs()[0]));
        result.getTokens().forEach(t ->
            out.printf("%4d:%-4d %-18s %s%n", t.getLine(), t.getColumn(), t.getTypeName(), t.getLexeme()));
        result.getErrors().forEach(e -> err.println("Error: " + e));
    }

    @Command("Parse an arithmetic expression and print its tree")
    public void parse(String[] args) throws IOException {
        CommandLine cmd = parseArgs("parse [-c file] [-v] FILE", args, 1, 1, COMMON_OPTIONS);
        CompilerPipeline pipeline = CompilerPipeline.fromConfig(config(cmd));

        LexResult lexed = pipeline.newLexer().tokenize(read(cmd.getArgs()[0]));
        ParseResult result = new Parser().parse(lexed.getTokens());
        out.println(result.getTree().render());
        result.getErrors().forEach(e -> err.println("Error: " + e));
    }

    @Command("Check declarations and types, print the symbol table")
    public void analyze(String[] args) throws IOException {
        CommandLine cmd = parseArgs("analyze [-c file] [-v] FILE", args, 1, 1, COMMON_OPTIONS);
        CompilerPipeline pipeline = CompilerPipeline.fromConfig(config(cmd));

        AnalysisResult result = pipeline.compile(read(cmd.getArgs()[0])).getAnalysis();
        out.print(result.getSymbolTable().render());
        out.print(result.formatDiagnostics());
    }

    @Command("Translate a source file to another language")
    public void generate(String[] args) throws IOException {
        CommandLine cmd = parseArgs("generate [-c file] [-v] [-t target] [-p] [-f] FILE", args, 1, 1, COMMON_OPTIONS, GENERATE_OPTIONS);
        Config config = config(cmd);

        GeneratorOptions options = GeneratorOptions.fromConfig(config);
        if (cmd.hasOption('t')) {
            String name = cmd.getOptionValue('t');
            options = options.withTarget(TargetLanguage.fromName(name).orElseThrow(() ->
                new UsageException("unknown target language: " + name)));
        }
        if (cmd.hasOption('p')) {
            options = options.withPreamble(true);
        }

        CompilerPipeline pipeline = new CompilerPipeline(
            LexerOptions.fromConfig(config), AnalyzerOptions.fromConfig(config), options);
        CompilationReport report = pipeline.compile(read(cmd.getArgs()[0]), options.getTarget(), cmd.hasOption('f'));
        err.print(report.getAnalysis().formatDiagnostics());

        if (!report.isGenerated()) {
            throw new IllegalStateException(report.getAnalysis().getErrors().size()
                + " semantic error(s), use -f to generate anyway");
        }

        GenerationResult generated = report.getGeneration().get();
        out.print(generated.getCode());
        generated.getSkipped().forEach(r -> err.println("Skipped: " + r));
    }

    @Command("List the built-in automata")
    public void automata(String[] args) {
        verbose(parseArgs("automata [-v]", args, 0, 0, VERBOSE_OPTIONS));
        AutomatonRegistry registry = AutomatonRegistry.withDefaults();
        for (String id : registry.getIds()) {
            Automaton a = registry.get(id).get();
            out.printf("%-12s %-4s %3d states %5d transitions%n",
                       id, a.getType(), a.getStateCount(), a.getTransitionCount());
        }
    }

    @Command("Convert a built-in automaton to a DFA")
    public void convert(String[] args) {
        CommandLine cmd = parseArgs("convert [-v] ID", args, 1, 1, VERBOSE_OPTIONS);
        verbose(cmd);
        Automaton source = automaton(cmd.getArgs()[0]);
        Automaton dfa = NfaToDfa.convert(source).orElseThrow(() ->
            new IllegalStateException("cannot convert " + source.getId()));
        out.print(dfa.render());
    }

    @Command("Minimize a built-in DFA")
    public void minimize(String[] args) {
        CommandLine cmd = parseArgs("minimize [-v] ID", args, 1, 1, VERBOSE_OPTIONS);
        verbose(cmd);
        Automaton source = automaton(cmd.getArgs()[0]);
        Automaton minimal = DfaMinimizer.minimize(source).orElseThrow(() ->
            new IllegalStateException("cannot minimize " + source.getId()));
        out.print(minimal.render());
    }

    @Command("Run input strings through a built-in automaton")
    public void simulate(String[] args) {
        CommandLine cmd = parseArgs("simulate [-v] ID INPUT...", args, 2, Integer.MAX_VALUE, VERBOSE_OPTIONS);
        verbose(cmd);
        List<String> rest = cmd.getArgList();
        Automaton automaton = automaton(rest.get(0));
        for (String input : rest.subList(1, rest.size())) {
            out.printf("%s: %s%n", input, automaton.accepts(input) ? "accepted" : "rejected");
        }
    }

    @Command("Find the built-in automaton accepting each text")
    public void match(String[] args) {
        CommandLine cmd = parseArgs("match [-v] TEXT...", args, 1, Integer.MAX_VALUE, VERBOSE_OPTIONS);
        verbose(cmd);
        AutomatonRegistry registry = AutomatonRegistry.withDefaults();
        for (String text : cmd.getArgs()) {
            out.printf("%s: %s%n", text, registry.findMatchingAutomaton(text).orElse("no match"));
        }
    }

    private Automaton automaton(String id) {
        return AutomatonRegistry.withDefaults().get(id).orElseThrow(() ->
            new UsageException(id + ": no such automaton. Use \"ctk automata\" to list them"));
    }

    private CommandLine parseArgs(String usage, String[] args, int min, int max, Option[]... groups) {
        Options options = new Options();
        Stream.of(groups).flatMap(Arrays::stream).forEach(options::addOption);

        CommandLine cmd;
        try {
            CommandLineParser parser = new PosixParser();
            cmd = parser.parse(options, args);
        } catch (ParseException ex) {
            printHelp(usage, options);
            throw new UsageException(ex.getMessage());
        }

        int count = cmd.getArgs().length;
        if (count < min || count > max) {
            printHelp(usage, options);
            throw new UsageException(null);
        }
        return cmd;
    }

    private void printHelp(String usage, Options options) {
        PrintWriter writer = new PrintWriter(err);
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "ctk " + usage, null, options,
                            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    private Config config(CommandLine cmd) {
        verbose(cmd);
        String file = cmd.getOptionValue('c');
        return file != null ? new Config(Paths.get(file)) : Config.getDefault();
    }

    private static void verbose(CommandLine cmd) {
        if (cmd.hasOption('v') && rootLogger.getLevel() != Level.FINE) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            rootLogger.addHandler(handler);
            rootLogger.setLevel(Level.FINE);
        }
    }

    private static String read(String path) throws IOException {
        return Files.asCharSource(new File(path), StandardCharsets.UTF_8).read();
    }
}
