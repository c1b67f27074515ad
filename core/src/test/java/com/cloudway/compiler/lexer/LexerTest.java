/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.Rule;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.cloudway.compiler.automaton.Automaton;
import com.cloudway.compiler.automaton.AutomatonMatch;
import com.cloudway.compiler.automaton.AutomatonMatcher;
import com.cloudway.compiler.automaton.AutomatonRegistry;
import com.cloudway.compiler.automaton.AutomatonType;
import com.cloudway.compiler.automaton.State;

import static com.cloudway.compiler.lexer.TokenType.*;

public class LexerTest
{
    public final @Rule JUnitRuleMockery context = new JUnitRuleMockery();

    private static List<TokenType> types(LexResult result) {
        return result.getTokens().stream().map(Token::getType).collect(Collectors.toList());
    }

    private static List<String> lexemes(LexResult result) {
        return result.getTokens().stream().map(Token::getLexeme).collect(Collectors.toList());
    }

    @Test
    public void integer_literal() {
        LexResult result = new Lexer().tokenize("123");
        assertTrue(result.isSuccess());
        assertEquals(Arrays.asList(INTEGER_LITERAL, END_OF_FILE), types(result));
        assertEquals("123", result.getTokens().get(0).getLexeme());
        assertEquals("INTEGER", result.getTokens().get(0).getAutomatonId());
    }

    @Test
    public void float_literal() {
        LexResult result = new Lexer().tokenize("12.5");
        assertEquals(Arrays.asList(FLOAT_LITERAL, END_OF_FILE), types(result));
        assertEquals("12.5", result.getTokens().get(0).getLexeme());
    }

    @Test
    public void dot_without_digit_is_not_float() {
        LexResult result = new Lexer().tokenize("12.");
        assertEquals(Arrays.asList(INTEGER_LITERAL, DOT, END_OF_FILE), types(result));
    }

    @Test
    public void unterminated_string() {
        LexResult result = new Lexer().tokenize("\"abc");
        assertFalse(result.isSuccess());
        assertEquals(1, result.getErrors().size());
        assertEquals(Arrays.asList(UNKNOWN, END_OF_FILE), types(result));

        LexError error = result.getErrors().get(0);
        assertEquals("Unterminated string literal", error.getMessage());
        assertEquals("Error at Line 1, Column 1: Unterminated string literal (near '\"abc')", error.toString());
    }

    @Test
    public void string_must_close_before_newline() {
        LexResult result = new Lexer().tokenize("\"abc\nx");
        assertEquals(1, result.getErrors().size());
        assertEquals(Arrays.asList(UNKNOWN, IDENTIFIER, END_OF_FILE), types(result));
    }

    @Test
    public void string_with_escapes() {
        LexResult result = new Lexer().tokenize("\"a\\\"b\" x");
        assertTrue(result.isSuccess());
        assertEquals(Arrays.asList(STRING_LITERAL, IDENTIFIER, END_OF_FILE), types(result));
        assertEquals("\"a\\\"b\"", result.getTokens().get(0).getLexeme());
    }

    @Test
    public void char_literals() {
        LexResult ok = new Lexer().tokenize("'a' '\\n'");
        assertTrue(ok.isSuccess());
        assertEquals(Arrays.asList(CHAR_LITERAL, CHAR_LITERAL, END_OF_FILE), types(ok));

        LexResult empty = new Lexer().tokenize("''");
        assertEquals("Empty character literal", empty.getErrors().get(0).getMessage());

        LexResult unterminated = new Lexer().tokenize("'ab'");
        assertEquals("Unterminated character literal", unterminated.getErrors().get(0).getMessage());
        assertEquals(UNKNOWN, unterminated.getTokens().get(0).getType());
    }

    @Test
    public void keywords_ignore_case() {
        LexResult result = new Lexer().tokenize("INT while foo While_1");
        assertEquals(Arrays.asList(KEYWORD, KEYWORD, IDENTIFIER, IDENTIFIER, END_OF_FILE), types(result));
    }

    @Test
    public void maximal_munch_operators() {
        LexResult result = new Lexer().tokenize("a<=b<<c++ += != && || >> -- -= = < !");
        assertEquals(Arrays.asList(
            IDENTIFIER, LESS_EQUAL, IDENTIFIER, SHIFT_LEFT, IDENTIFIER, INCREMENT,
            PLUS_ASSIGN, NOT_EQUAL, LOGICAL_AND, LOGICAL_OR, SHIFT_RIGHT, DECREMENT,
            MINUS_ASSIGN, ASSIGN, LESS_THAN, LOGICAL_NOT, END_OF_FILE), types(result));
    }

    @Test
    public void comments_are_skipped_by_default() {
        LexResult result = new Lexer().tokenize("x // note\ny");
        assertEquals(Arrays.asList("x", "y", ""), lexemes(result));
    }

    @Test
    public void comments_can_be_kept() {
        Lexer lexer = new Lexer(LexerOptions.defaults().withSkipComments(false), null);
        LexResult result = lexer.tokenize("x // note\ny");
        assertEquals(Arrays.asList(IDENTIFIER, COMMENT, IDENTIFIER, END_OF_FILE), types(result));
        assertEquals("// note", result.getTokens().get(1).getLexeme());
    }

    @Test
    public void whitespace_can_be_kept() {
        Lexer lexer = new Lexer(LexerOptions.defaults().withSkipWhitespace(false), null);
        LexResult result = lexer.tokenize("a  b\nc");
        assertEquals(Arrays.asList(IDENTIFIER, WHITESPACE, IDENTIFIER, NEWLINE, IDENTIFIER, END_OF_FILE),
                     types(result));
        assertEquals("  ", result.getTokens().get(1).getLexeme());
    }

    @Test
    public void positions() {
        LexResult result = new Lexer().tokenize("int x;\n  y = 2;");
        Token y = result.getTokens().get(3);
        assertEquals("y", y.getLexeme());
        assertEquals(2, y.getLine());
        assertEquals(3, y.getColumn());

        Token eof = result.getTokens().get(result.getTokens().size() - 1);
        assertEquals(END_OF_FILE, eof.getType());
        assertEquals(2, eof.getLine());
        assertEquals(9, eof.getColumn());
        assertEquals("Token(EOF, \"\", Line: 2, Col: 9)", eof.toString());
    }

    @Test
    public void unexpected_character_is_kept_as_unknown() {
        LexResult result = new Lexer().tokenize("a @ b");
        assertFalse(result.isSuccess());
        assertEquals(Arrays.asList(IDENTIFIER, UNKNOWN, IDENTIFIER, END_OF_FILE), types(result));
        LexError error = result.getErrors().get(0);
        assertEquals("Unexpected character", error.getMessage());
        assertEquals(1, error.getLine());
        assertEquals(3, error.getColumn());
        assertEquals("@", error.getLexeme());
    }

    @Test
    public void fallback_takes_longest_accepted_prefix() {
        AutomatonMatcher matcher = context.mock(AutomatonMatcher.class);
        context.checking(new Expectations() {{
            oneOf(matcher).findLongestMatch("x = $$!", 4);
                will(returnValue(Optional.of(new AutomatonMatch("MONEY", 2))));
        }});

        LexResult result = new Lexer(matcher).tokenize("x = $$!");
        assertTrue(result.isSuccess());
        Token money = result.getTokens().get(2);
        assertEquals(UNKNOWN, money.getType());
        assertEquals("$$", money.getLexeme());
        assertEquals("MONEY", money.getAutomatonId());
        assertEquals(LOGICAL_NOT, result.getTokens().get(3).getType());
    }

    @Test
    public void fallback_maps_standard_automata() {
        AutomatonMatcher matcher = context.mock(AutomatonMatcher.class);
        context.checking(new Expectations() {{
            oneOf(matcher).findLongestMatch("@", 0);
                will(returnValue(Optional.of(new AutomatonMatch("IDENTIFIER", 1))));
        }});

        LexResult result = new Lexer(matcher).tokenize("@");
        assertTrue(result.isSuccess());
        assertEquals(IDENTIFIER, result.getTokens().get(0).getType());
        assertEquals("IDENTIFIER", result.getTokens().get(0).getAutomatonId());
    }

    @Test
    public void fallback_without_match_reports_error() {
        AutomatonMatcher matcher = context.mock(AutomatonMatcher.class);
        context.checking(new Expectations() {{
            allowing(matcher).findLongestMatch(with(any(CharSequence.class)), with(any(Integer.class)));
                will(returnValue(Optional.empty()));
        }});

        LexResult result = new Lexer(matcher).tokenize("#");
        assertEquals(1, result.getErrors().size());
        assertEquals(UNKNOWN, result.getTokens().get(0).getType());
        assertNull(result.getTokens().get(0).getAutomatonId());
    }

    @Test
    public void fallback_with_registered_automaton() {
        Automaton hash = new Automaton("HASH", "Hash sign", AutomatonType.DFA);
        hash.addState(new State("q0", true, false));
        hash.addState(new State("q1", false, true));
        hash.addTransition("q0", "q1", "#");

        AutomatonRegistry registry = AutomatonRegistry.withDefaults();
        registry.add(hash);

        LexResult result = new Lexer(registry).tokenize("#include");
        assertTrue(result.isSuccess());
        assertEquals("HASH", result.getTokens().get(0).getAutomatonId());
        assertEquals(Arrays.asList("#", "include", ""), lexemes(result));
    }

    @Test(timeout = 5000)
    public void fallback_scan_stops_when_no_automaton_is_live() {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 400; i++) {
            source.append("#define VALUE_").append(i).append(" 12345 // padding to make the line longer\n");
        }

        LexResult result = new Lexer(AutomatonRegistry.withDefaults()).tokenize(source.toString());
        assertEquals(400, result.getErrors().size());
        assertEquals("#", result.getErrors().get(399).getLexeme());
        assertEquals(400, result.getErrors().get(399).getLine());
    }

    @Test
    public void reports_and_reset() {
        Lexer lexer = new Lexer();
        lexer.tokenize("a ?");
        assertTrue(lexer.hasErrors());
        assertThat(lexer.formatTokens(), containsString("Token(IDENTIFIER, \"a\", Line: 1, Col: 1)\n"));
        assertThat(lexer.formatErrors(), containsString("Unexpected character (near '?')"));

        lexer.reset();
        assertFalse(lexer.hasErrors());
        assertTrue(lexer.getTokens().isEmpty());
    }

    @Test
    public void type_display_names() {
        assertEquals("INTEGER", INTEGER_LITERAL.getDisplayName());
        assertEquals("AND", LOGICAL_AND.getDisplayName());
        assertEquals("BIT_XOR", BITWISE_XOR.getDisplayName());
        assertEquals("EOF", END_OF_FILE.getDisplayName());
        assertEquals("SEMICOLON", SEMICOLON.getDisplayName());
    }
}
