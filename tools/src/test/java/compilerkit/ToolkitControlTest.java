/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package compilerkit;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.io.Files;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ToolkitControlTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private ToolkitControl control;

    @Before
    public void setUp() throws UnsupportedEncodingException {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        control = new ToolkitControl(new PrintStream(stdout, true, "UTF-8"),
                                     new PrintStream(stderr, true, "UTF-8"));
    }

    private String out() {
        return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(stderr.toByteArray(), StandardCharsets.UTF_8);
    }

    private String source(String text) throws IOException {
        File file = folder.newFile();
        Files.asCharSink(file, StandardCharsets.UTF_8).write(text);
        return file.getPath();
    }

    @Test
    public void missingCommand() {
        assertThat(control.execute(new String[0]), is(1));
        assertThat(err(), containsString("invalid command"));
    }

    @Test
    public void unknownCommand() {
        assertThat(control.execute(new String[] {"compile-all"}), is(1));
        assertThat(control.execute(new String[] {"execute"}), is(1));
    }

    @Test
    public void helpListsCommands() {
        assertThat(control.execute(new String[] {"help"}), is(0));
        assertThat(err(), containsString("  generate  Translate a source file to another language"));
        assertThat(err(), containsString("  simulate  "));
    }

    @Test
    public void tokenize() throws IOException {
        assertThat(control.execute(new String[] {"tokenize", source("int x = 5;")}), is(0));
        assertThat(out(), containsString(" x\n"));
        assertThat(out(), containsString(" 5\n"));
    }

    @Test
    public void parse() throws IOException {
        assertThat(control.execute(new String[] {"parse", source("a + b * 2")}), is(0));
        assertThat(out(), startsWith("Parse Tree for: "));
        assertThat(out(), containsString("Terminal: id (a)"));
        assertThat(err(), is(""));
    }

    @Test
    public void analyze() throws IOException {
        assertThat(control.execute(new String[] {"analyze", source("int x = 5;\ny = 2;\n")}), is(0));
        assertThat(out(), containsString("x : int = 5"));
        assertThat(out(), containsString("Error: Line 2: Undeclared variable 'y'"));
    }

    @Test
    public void generateForTarget() throws IOException {
        String file = source("int x = 5;");
        assertThat(control.execute(new String[] {"generate", "-t", "java", file}), is(0));
        assertThat(out(), is("int x = 5;\n"));
    }

    @Test
    public void generateDefaultsToPython() throws IOException {
        assertThat(control.execute(new String[] {"generate", source("int x = 5;")}), is(0));
        assertThat(out(), is("x = 5\n"));
    }

    @Test
    public void generateWithPreamble() throws IOException {
        assertThat(control.execute(new String[] {"generate", "-p", "-t", "js", source("int x = 5;")}), is(0));
        assertThat(out(), is("// Generated JavaScript Code\n\nlet x = 5;\n"));
    }

    @Test
    public void semanticErrorsStopGeneration() throws IOException {
        String file = source("y = 1;");
        assertThat(control.execute(new String[] {"generate", file}), is(2));
        assertThat(err(), containsString("command failure: "));
        assertThat(out(), is(""));

        assertThat(control.execute(new String[] {"generate", "-f", file}), is(0));
        assertThat(out(), is("y = 1\n"));
    }

    @Test
    public void badArguments() throws IOException {
        assertThat(control.execute(new String[] {"generate", "-t", "cobol", source("int x;")}), is(1));
        assertThat(err(), containsString("unknown target language: cobol"));
        assertThat(control.execute(new String[] {"generate"}), is(1));
        assertThat(control.execute(new String[] {"tokenize", "-z", "file"}), is(1));
    }

    @Test
    public void missingFile() {
        assertThat(control.execute(new String[] {"tokenize", "/nonexistent/input.cpp"}), is(2));
        assertThat(err(), containsString("command failure: "));
    }

    @Test
    public void automata() {
        assertThat(control.execute(new String[] {"automata"}), is(0));
        assertThat(out(), containsString("IDENTIFIER"));
        assertThat(out(), containsString("FLOAT"));
    }

    @Test
    public void simulate() {
        assertThat(control.execute(new String[] {"simulate", "INTEGER", "42", "4a"}), is(0));
        assertThat(out(), is("42: accepted\n4a: rejected\n"));
    }

    @Test
    public void match() {
        assertThat(control.execute(new String[] {"match", "count", "42", "3.14", "@"}), is(0));
        assertThat(out(), is("count: IDENTIFIER\n42: INTEGER\n3.14: FLOAT\n@: no match\n"));
    }

    @Test
    public void automatonCommandsHonorVerbose() {
        Logger root = Logger.getLogger("com.cloudway.compiler");
        try {
            assertThat(control.execute(new String[] {"simulate", "-v", "INTEGER", "42"}), is(0));
            assertThat(out(), is("42: accepted\n"));
            assertThat(root.getLevel(), is(Level.FINE));
        } finally {
            for (Handler handler : root.getHandlers()) {
                root.removeHandler(handler);
            }
            root.setLevel(null);
        }
    }

    @Test
    public void automatonCommandsRejectConfigFile() {
        assertThat(control.execute(new String[] {"automata", "-c", "toolkit.conf"}), is(1));
        assertThat(err(), containsString("usage: ctk automata [-v]"));
    }

    @Test
    public void convertAndMinimize() {
        assertThat(control.execute(new String[] {"convert", "INTEGER"}), is(0));
        assertThat(out(), containsString("(DFA)"));
        assertThat(control.execute(new String[] {"minimize", "FLOAT"}), is(0));
        assertThat(control.execute(new String[] {"minimize", "NOPE"}), is(1));
        assertThat(err(), containsString("NOPE: no such automaton"));
    }
}
