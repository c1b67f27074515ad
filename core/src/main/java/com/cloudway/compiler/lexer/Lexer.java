/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

import com.cloudway.compiler.automaton.AutomatonMatch;
import com.cloudway.compiler.automaton.AutomatonMatcher;
import com.cloudway.compiler.automaton.AutomatonRegistry;

/**
 * A hand-written scanner for a small C-like language.
 *
 * <p>Each token is recognized by the first rule that applies: comment,
 * string, character, number, identifier or keyword, operator. Text that no
 * rule covers is offered to the {@link AutomatonMatcher}, which picks the
 * longest prefix accepted by any of its automata. Anything left is reported
 * as an unexpected character and skipped one character at a time, so the
 * scan always reaches the end of the input.</p>
 */
public class Lexer
{
    private static final Logger logger = Logger.getLogger(Lexer.class.getName());

    private final LexerOptions options;
    private AutomatonMatcher matcher;

    private String input = "";
    private int position;
    private int line;
    private int column;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexError> errors = new ArrayList<>();

    public Lexer() {
        this(LexerOptions.defaults(), null);
    }

    public Lexer(AutomatonMatcher matcher) {
        this(LexerOptions.defaults(), matcher);
    }

    /**
     * @param options scanning switches
     * @param matcher fallback recognizer, may be null
     */
    public Lexer(LexerOptions options, AutomatonMatcher matcher) {
        this.options = requireNonNull(options);
        this.matcher = matcher;
        reset();
    }

    public void setMatcher(AutomatonMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * Scans the source text. The token list always ends with an
     * {@code END_OF_FILE} token.
     */
    public LexResult tokenize(String source) {
        reset();
        input = requireNonNull(source);

        while (!isAtEnd()) {
            Token token = scanToken();
            if (token.is(TokenType.COMMENT) && options.isSkipComments())
                continue;
            if (token.getType().isTrivia() && options.isSkipWhitespace())
                continue;
            tokens.add(token);
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, column));

        logger.fine(() -> String.format("Tokenized %d characters into %d tokens with %d errors",
                                        input.length(), tokens.size(), errors.size()));
        return new LexResult(tokens, errors);
    }

    public void reset() {
        input = "";
        position = 0;
        line = 1;
        column = 1;
        tokens.clear();
        errors.clear();
    }

    public List<Token> getTokens() {
        return ImmutableList.copyOf(tokens);
    }

    public List<LexError> getErrors() {
        return ImmutableList.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns one line per token of the last scan.
     */
    public String formatTokens() {
        StringBuilder out = new StringBuilder();
        tokens.forEach(t -> out.append(t).append('\n'));
        return out.toString();
    }

    /**
     * Returns one line per error of the last scan.
     */
    public String formatErrors() {
        StringBuilder out = new StringBuilder();
        errors.forEach(e -> out.append(e).append('\n'));
        return out.toString();
    }

    // Scanning

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private char peek() {
        return isAtEnd() ? '\0' : input.charAt(position);
    }

    private char peekNext() {
        return position + 1 >= input.length() ? '\0' : input.charAt(position + 1);
    }

    private char advance() {
        char c = input.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private Token scanToken() {
        int startLine = line, startColumn = column;
        char c = peek();

        if (c == '\n') {
            advance();
            return new Token(TokenType.NEWLINE, "\n", startLine, startColumn);
        }
        if (isBlank(c))
            return scanWhitespace();
        if (c == '/' && peekNext() == '/')
            return scanComment();
        if (c == '"')
            return scanString();
        if (c == '\'')
            return scanChar();
        if (isDigit(c))
            return scanNumber();
        if (isAlpha(c) || c == '_')
            return scanIdentifier();

        Optional<Token> token = scanOperator();
        if (!token.isPresent() && matcher != null) {
            token = scanWithAutomata();
        }
        if (token.isPresent()) {
            return token.get();
        }

        String lexeme = String.valueOf(advance());
        addError("Unexpected character", startLine, startColumn, lexeme);
        return new Token(TokenType.UNKNOWN, lexeme, startLine, startColumn);
    }

    private Token scanWhitespace() {
        int startLine = line, startColumn = column;
        StringBuilder text = new StringBuilder();
        while (!isAtEnd() && isBlank(peek())) {
            text.append(advance());
        }
        return new Token(TokenType.WHITESPACE, text.toString(), startLine, startColumn);
    }

    private Token scanComment() {
        int startLine = line, startColumn = column;
        StringBuilder text = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') {
            text.append(advance());
        }
        return new Token(TokenType.COMMENT, text.toString(), startLine, startColumn);
    }

    private Token scanString() {
        int startLine = line, startColumn = column;
        StringBuilder text = new StringBuilder();
        text.append(advance());

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                break;
            }
            if (peek() == '\\') {
                text.append(advance());
                if (!isAtEnd() && peek() != '\n') {
                    text.append(advance());
                }
            } else {
                text.append(advance());
            }
        }

        if (isAtEnd() || peek() != '"') {
            addError("Unterminated string literal", startLine, startColumn, text.toString());
            return new Token(TokenType.UNKNOWN, text.toString(), startLine, startColumn);
        }

        text.append(advance());
        return new Token(TokenType.STRING_LITERAL, text.toString(), startLine, startColumn);
    }

    private Token scanChar() {
        int startLine = line, startColumn = column;
        StringBuilder text = new StringBuilder();
        text.append(advance());

        if (isAtEnd() || peek() == '\'') {
            addError("Empty character literal", startLine, startColumn, text.toString());
            return new Token(TokenType.UNKNOWN, text.toString(), startLine, startColumn);
        }

        if (peek() == '\\') {
            text.append(advance());
            if (!isAtEnd()) {
                text.append(advance());
            }
        } else {
            text.append(advance());
        }

        if (peek() != '\'') {
            addError("Unterminated character literal", startLine, startColumn, text.toString());
            return new Token(TokenType.UNKNOWN, text.toString(), startLine, startColumn);
        }

        text.append(advance());
        return new Token(TokenType.CHAR_LITERAL, text.toString(), startLine, startColumn);
    }

    private Token scanNumber() {
        int startLine = line, startColumn = column;
        StringBuilder text = new StringBuilder();
        while (isDigit(peek())) {
            text.append(advance());
        }

        boolean isFloat = peek() == '.' && isDigit(peekNext());
        if (isFloat) {
            text.append(advance());
            while (isDigit(peek())) {
                text.append(advance());
            }
        }

        return isFloat
            ? new Token(TokenType.FLOAT_LITERAL, text.toString(), startLine, startColumn, AutomatonRegistry.FLOAT)
            : new Token(TokenType.INTEGER_LITERAL, text.toString(), startLine, startColumn, AutomatonRegistry.INTEGER);
    }

    private Token scanIdentifier() {
        int startLine = line, startColumn = column;
        StringBuilder text = new StringBuilder();
        while (isAlpha(peek()) || isDigit(peek()) || peek() == '_') {
            text.append(advance());
        }
        String word = text.toString();
        return new Token(Keywords.classify(word), word, startLine, startColumn, AutomatonRegistry.IDENTIFIER);
    }

    private Optional<Token> scanOperator() {
        int startLine = line, startColumn = column;

        if (position + 1 < input.length()) {
            String two = input.substring(position, position + 2);
            Optional<TokenType> type = Operators.lookupTwoChar(two);
            if (type.isPresent()) {
                advance();
                advance();
                return Optional.of(new Token(type.get(), two, startLine, startColumn));
            }
        }

        char c = peek();
        return Operators.lookupOneChar(c).map(type -> {
            advance();
            return new Token(type, String.valueOf(c), startLine, startColumn);
        });
    }

    /**
     * Asks the matcher for the longest accepted prefix of the remaining
     * input.
     */
    private Optional<Token> scanWithAutomata() {
        int startLine = line, startColumn = column;
        Optional<AutomatonMatch> match = matcher.findLongestMatch(input, position);
        if (!match.isPresent()) {
            return Optional.empty();
        }

        String automatonId = match.get().getAutomatonId();
        String lexeme = input.substring(position, position + match.get().getLength());
        for (int i = 0; i < lexeme.length(); i++) {
            advance();
        }
        return Optional.of(new Token(typeOfMatch(automatonId, lexeme), lexeme, startLine, startColumn, automatonId));
    }

    private static TokenType typeOfMatch(String automatonId, String lexeme) {
        switch (automatonId) {
        case AutomatonRegistry.IDENTIFIER:
            return Keywords.classify(lexeme);
        case AutomatonRegistry.INTEGER:
            return TokenType.INTEGER_LITERAL;
        case AutomatonRegistry.FLOAT:
            return TokenType.FLOAT_LITERAL;
        default:
            return TokenType.UNKNOWN;
        }
    }

    private void addError(String message, int line, int column, String lexeme) {
        errors.add(new LexError(message, line, column, lexeme));
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
