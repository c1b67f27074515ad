/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import java.util.List;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.cloudway.compiler.lexer.Lexer;
import com.cloudway.compiler.lexer.LexerOptions;
import com.cloudway.compiler.lexer.Token;
import com.cloudway.compiler.lexer.TokenType;

public class ConstantFolderTest
{
    private static List<Token> fold(String source) {
        return ConstantFolder.fold(new Lexer().tokenize(source).getTokens());
    }

    private static String lexemes(List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        for (Token t : tokens) {
            if (!t.is(TokenType.END_OF_FILE))
                buf.append(t.getLexeme()).append(' ');
        }
        return buf.toString().trim();
    }

    @Test
    public void chainCollapsesToOneLiteral() {
        List<Token> tokens = fold("x = 1 + 2 + 3;");
        assertThat(lexemes(tokens), is("x = 6 ;"));
        Token six = tokens.get(2);
        assertTrue(six.is(TokenType.INTEGER_LITERAL));
        assertThat(six.getColumn(), is(5));
    }

    @Test
    public void precedenceIsRespected() {
        assertThat(lexemes(fold("y = a * 2 + 3;")), is("y = a * 2 + 3 ;"));
        assertThat(lexemes(fold("y = a - 2 + 3;")), is("y = a - 2 + 3 ;"));
        assertThat(lexemes(fold("y = 2 + 3 * 4;")), is("y = 2 + 3 * 4 ;"));
        assertThat(lexemes(fold("y = a + 2 + 3;")), is("y = a + 5 ;"));
        assertThat(lexemes(fold("x = ~1 + 2;")), is("x = ~ 1 + 2 ;"));
        assertThat(lexemes(fold("x = !0 + 2;")), is("x = ! 0 + 2 ;"));
        assertThat(lexemes(fold("x = 4 + ~1 + 2;")), is("x = 4 + ~ 1 + 2 ;"));
    }

    @Test
    public void octalLiteralsAreNotFolded() {
        assertThat(lexemes(fold("x = 010 + 1;")), is("x = 010 + 1 ;"));
        assertThat(lexemes(fold("x = 1 + 07;")), is("x = 1 + 07 ;"));
        assertThat(lexemes(fold("x = 0 + 1;")), is("x = 1 ;"));
    }

    @Test
    public void overflowIsNotFolded() {
        assertThat(lexemes(fold("2147483647 + 1")), is("2147483647 + 1"));
    }

    @Test
    public void floatsAreNotFolded() {
        assertThat(lexemes(fold("1.5 + 2")), is("1.5 + 2"));
    }

    @Test
    public void whitespaceTokensAreDropped() {
        Lexer lexer = new Lexer(LexerOptions.defaults().withSkipWhitespace(false), null);
        List<Token> tokens = ConstantFolder.fold(lexer.tokenize("4 + 5").getTokens());
        assertThat(lexemes(tokens), is("9"));
    }
}
