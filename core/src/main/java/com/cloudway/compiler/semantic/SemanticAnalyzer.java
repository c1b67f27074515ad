/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;

import com.cloudway.compiler.lexer.Token;
import com.cloudway.compiler.lexer.TokenCursor;
import com.cloudway.compiler.lexer.TokenType;
import com.cloudway.compiler.semantic.SemanticError.Severity;

/**
 * Statement level semantic checks over a token stream.
 *
 * <p>The analyzer walks the tokens once, declaring variables, parameters
 * and functions into a scoped {@link SymbolTable}, and reports use of
 * undeclared names, redeclaration within a scope and incompatible
 * initializers. Problems are collected and the walk always runs to the
 * end of the stream. Symbols that were never given a value are reported
 * as warnings once the walk is complete.</p>
 */
public class SemanticAnalyzer
{
    private static final Logger logger = Logger.getLogger(SemanticAnalyzer.class.getName());

    /**
     * The deepest statement nesting that is analyzed.
     */
    public static final int MAX_NESTING = 256;

    private static final ImmutableSet<String> TYPE_KEYWORDS = ImmutableSet.of(
        "int", "float", "string", "bool", "char", "double", "short", "long", "void");

    private static final ImmutableSet<TokenType> BOOLEAN_OPERATORS = ImmutableSet.of(
        TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS_THAN, TokenType.GREATER_THAN,
        TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL, TokenType.LOGICAL_AND,
        TokenType.LOGICAL_OR, TokenType.LOGICAL_NOT);

    private final AnalyzerOptions options;

    public SemanticAnalyzer() {
        this(AnalyzerOptions.defaults());
    }

    public SemanticAnalyzer(AnalyzerOptions options) {
        this.options = requireNonNull(options);
    }

    public AnalyzerOptions getOptions() {
        return options;
    }

    /**
     * Analyzes a token stream with a fresh symbol table.
     */
    public AnalysisResult analyze(List<Token> tokens) {
        Pass pass = new Pass(new TokenCursor(tokens), options);
        AnalysisResult result = pass.run();
        logger.fine(() -> String.format("Analyzed %d tokens: %d symbols, %d errors, %d warnings",
                                        tokens.size(), result.getDiscoveredSymbols().size(),
                                        result.getErrors().size(), result.getWarnings().size()));
        return result;
    }

    public static boolean isTypeKeyword(String word) {
        return TYPE_KEYWORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    static boolean isTypeKeyword(Token token) {
        return token.is(TokenType.KEYWORD) && isTypeKeyword(token.getLexeme())
            || token.is(TokenType.IDENTIFIER) && isTypeKeyword(token.getLexeme());
    }

    /**
     * The state of a single analysis.
     */
    private static final class Pass {
        private final TokenCursor cursor;
        private final AnalyzerOptions options;
        private final SymbolTable symbols = new SymbolTable();
        private final List<SemanticError> errors = new ArrayList<>();
        private final List<SemanticError> warnings = new ArrayList<>();
        private int nesting;

        Pass(TokenCursor cursor, AnalyzerOptions options) {
            this.cursor = cursor;
            this.options = options;
        }

        AnalysisResult run() {
            while (!cursor.isAtEnd()) {
                int start = cursor.position();
                statement();
                if (cursor.position() == start) {
                    cursor.advance();
                }
            }

            for (Symbol symbol : symbols.getDiscoveredSymbols()) {
                if (!symbol.isInitialized()) {
                    warning(String.format("Variable '%s' declared but never initialized", symbol.getName()),
                            symbol.getLine());
                }
            }
            return new AnalysisResult(symbols, errors, warnings);
        }

        private void statement() {
            if (nesting >= MAX_NESTING) {
                error("Statements nested too deeply", cursor.peek().getLine());
                cursor.skipStatement();
                return;
            }
            nesting++;
            dispatch();
            nesting--;
        }

        private void dispatch() {
            Token token = cursor.peek();

            switch (token.getType()) {
            case KEYWORD:
                keywordStatement(token.getLexeme().toLowerCase(Locale.ROOT));
                break;

            case IDENTIFIER:
                if (token.getLexeme().equals("using") && cursor.peek(1).getLexeme().equals("namespace")) {
                    skipPast(TokenType.SEMICOLON);
                } else if (isTypeKeyword(token)) {
                    // 'short' and 'long' are not reserved words
                    typedStatement(false);
                } else if (cursor.peek(1).is(TokenType.ASSIGN)) {
                    assignment();
                } else {
                    checkUses(false);
                    cursor.match(TokenType.SEMICOLON);
                }
                break;

            case LBRACE:
                block();
                break;

            case UNKNOWN:
                if (token.getLexeme().equals("#")) {
                    skipLine(token.getLine());
                } else {
                    cursor.advance();
                }
                break;

            default:
                cursor.advance();
                break;
            }
        }

        private void keywordStatement(String keyword) {
            if (isTypeKeyword(keyword)) {
                typedStatement(false);
                return;
            }

            switch (keyword) {
            case "const":
                cursor.advance();
                if (isTypeKeyword(cursor.peek())) {
                    typedStatement(true);
                } else {
                    error("Expected type after 'const'", cursor.peek().getLine());
                    skipPast(TokenType.SEMICOLON);
                }
                break;
            case "if":
                ifStatement();
                break;
            case "while":
                whileStatement();
                break;
            case "for":
                forStatement();
                break;
            case "return":
                cursor.advance();
                checkUses(false);
                cursor.match(TokenType.SEMICOLON);
                break;
            default:
                cursor.advance();
                break;
            }
        }

        private void typedStatement(boolean constant) {
            if (cursor.peek(1).is(TokenType.IDENTIFIER) && cursor.peek(2).is(TokenType.LPAREN)) {
                functionDeclaration();
            } else {
                declaration(constant);
            }
        }

        // type name ( params ) { body }
        private void functionDeclaration() {
            Token returnType = cursor.advance();
            Token name = cursor.advance();

            Symbol function = Symbol.function(name.getLexeme(), SymbolType.fromName(returnType.getLexeme()),
                                              name.getLine());
            if (!symbols.declare(function)) {
                error(String.format("Function '%s' already declared in this scope", name.getLexeme()),
                      name.getLine());
            }

            expect(TokenType.LPAREN, "Expected '(' after function name.");
            symbols.enterScope();

            while (!cursor.isAtEnd() && !cursor.check(TokenType.RPAREN)) {
                if (isTypeKeyword(cursor.peek())) {
                    Token paramType = cursor.advance();
                    if (cursor.check(TokenType.IDENTIFIER)) {
                        parameter(paramType, cursor.advance());
                    } else if (!(paramType.getLexeme().equals("void") && cursor.check(TokenType.RPAREN))) {
                        error("Expected parameter name after type", paramType.getLine());
                    }
                } else {
                    error("Expected parameter type", cursor.peek().getLine());
                    break;
                }

                if (!cursor.check(TokenType.RPAREN) && !cursor.match(TokenType.COMMA)) {
                    error("Expected ',' or ')' in parameter list", cursor.peek().getLine());
                    break;
                }
            }

            expect(TokenType.RPAREN, "Expected ')' to close parameter list.");

            if (cursor.match(TokenType.LBRACE)) {
                // the body shares the parameter scope
                statementsUntilBrace();
                expect(TokenType.RBRACE, "Expected '}' to close block.");
            } else {
                error("Expected '{' after function signature", cursor.peek().getLine());
            }

            symbols.exitScope();
        }

        private void parameter(Token type, Token name) {
            Symbol param = new Symbol(name.getLexeme(), SymbolType.fromName(type.getLexeme()), name.getLine());
            param.setInitialized(true);
            if (!symbols.declare(param)) {
                error(String.format("Variable '%s' already declared in this scope", name.getLexeme()),
                      name.getLine());
            }
        }

        // type name [= expr] ;
        private void declaration(boolean constant) {
            Token typeToken = cursor.advance();
            SymbolType type = SymbolType.fromName(typeToken.getLexeme());

            if (!cursor.check(TokenType.IDENTIFIER)) {
                error("Expected identifier after type declaration", cursor.peek().getLine());
                skipPast(TokenType.SEMICOLON);
                return;
            }

            Token id = cursor.advance();
            String name = id.getLexeme();

            if (symbols.existsInCurrentScope(name)) {
                error(String.format("Variable '%s' already declared in this scope", name), id.getLine());
                skipPast(TokenType.SEMICOLON);
                return;
            }

            Symbol symbol = new Symbol(name, type, id.getLine());
            symbol.setConstant(constant);

            if (cursor.match(TokenType.ASSIGN)) {
                Optional<String> value = initializer(type, id, null);
                value.ifPresent(v -> {
                    symbol.setValue(v);
                    symbol.setInitialized(true);
                });
            }

            symbols.declare(symbol);
            cursor.match(TokenType.SEMICOLON);
        }

        // name = expr ;
        private void assignment() {
            Token id = cursor.advance();
            String name = id.getLexeme();
            Optional<Symbol> symbol = symbols.lookup(name);

            if (!symbol.isPresent() && !options.isBuiltin(name)) {
                error(String.format("Undeclared variable '%s'", name), id.getLine());
                skipPast(TokenType.SEMICOLON);
                return;
            }

            cursor.advance(); // '='

            if (symbol.isPresent() && symbol.get().isConstant()) {
                error(String.format("Cannot assign to constant '%s'", name), id.getLine());
            }

            SymbolType target = symbol.map(Symbol::getType).orElse(SymbolType.UNKNOWN);
            initializer(target, id, name).ifPresent(value -> {
                if (symbol.isPresent() && !symbol.get().isConstant()) {
                    symbols.update(name, value);
                }
            });

            cursor.match(TokenType.SEMICOLON);
        }

        /**
         * Checks the expression after an {@code =} against the target type.
         * Returns the expression text if it may be stored in the target.
         *
         * @param variable the variable name to mention in a mismatch, or
         *        null for a declaration
         */
        private Optional<String> initializer(SymbolType target, Token id, String variable) {
            if (cursor.isAtEnd() || cursor.check(TokenType.SEMICOLON)) {
                error("Expected value after '='", id.getLine());
                return Optional.empty();
            }

            int start = cursor.position();
            boolean undeclared = checkUses(false);
            List<Token> value = cursor.since(start);
            SymbolType actual = inferType(value);

            if (!undeclared && target != SymbolType.UNKNOWN && actual != SymbolType.UNKNOWN
                    && !target.accepts(actual)) {
                String message = variable == null
                    ? String.format("Type mismatch: cannot assign %s to %s", actual.getName(), target.getName())
                    : String.format("Type mismatch: cannot assign %s to %s variable '%s'",
                                    actual.getName(), target.getName(), variable);
                error(message, id.getLine());
                return Optional.empty();
            }
            if (undeclared) {
                return Optional.empty();
            }

            List<String> text = new ArrayList<>();
            value.forEach(t -> text.add(t.getLexeme()));
            return Optional.of(Joiner.on(' ').join(text));
        }

        /**
         * Infers the type of an expression. Comparisons and logical
         * operators make it boolean; otherwise the first operand decides.
         */
        private SymbolType inferType(List<Token> value) {
            for (Token t : value) {
                if (BOOLEAN_OPERATORS.contains(t.getType())) {
                    return SymbolType.BOOLEAN;
                }
            }
            for (Token t : value) {
                if (!t.is(TokenType.MINUS) && !t.is(TokenType.PLUS) && !t.is(TokenType.LPAREN)) {
                    return inferType(t);
                }
            }
            return SymbolType.UNKNOWN;
        }

        private SymbolType inferType(Token token) {
            switch (token.getType()) {
            case INTEGER_LITERAL:
                return SymbolType.INTEGER;
            case FLOAT_LITERAL:
                return SymbolType.FLOAT;
            case STRING_LITERAL:
                return SymbolType.STRING;
            case CHAR_LITERAL:
                return SymbolType.CHAR;
            case KEYWORD: {
                String keyword = token.getLexeme().toLowerCase(Locale.ROOT);
                return keyword.equals("true") || keyword.equals("false") ? SymbolType.BOOLEAN : SymbolType.UNKNOWN;
            }
            case IDENTIFIER:
                return symbols.lookup(token.getLexeme()).map(Symbol::getValueType).orElse(SymbolType.UNKNOWN);
            default:
                return SymbolType.UNKNOWN;
            }
        }

        private void ifStatement() {
            while (true) {
                cursor.advance();
                expect(TokenType.LPAREN, "Expected '(' after 'if'.");
                checkUses(true);
                expect(TokenType.RPAREN, "Expected ')' after if condition.");
                body();

                if (!cursor.check(TokenType.KEYWORD, "else"))
                    return;
                cursor.advance();
                if (!cursor.check(TokenType.KEYWORD, "if")) {
                    body();
                    return;
                }
            }
        }

        private void whileStatement() {
            cursor.advance();
            expect(TokenType.LPAREN, "Expected '(' after 'while'.");
            checkUses(true);
            expect(TokenType.RPAREN, "Expected ')' after while condition.");
            body();
        }

        // for ( init ; cond ; update ) body, the header has its own scope
        private void forStatement() {
            cursor.advance();
            expect(TokenType.LPAREN, "Expected '(' after 'for'.");
            symbols.enterScope();

            if (isTypeKeyword(cursor.peek())) {
                declaration(false);
            } else if (cursor.check(TokenType.IDENTIFIER) && cursor.peek(1).is(TokenType.ASSIGN)) {
                assignment();
            } else {
                checkUses(false);
                cursor.match(TokenType.SEMICOLON);
            }

            checkUses(false);
            expect(TokenType.SEMICOLON, "Expected ';' after for condition.");
            checkUses(true);
            expect(TokenType.RPAREN, "Expected ')' after for clauses.");

            body();
            symbols.exitScope();
        }

        private void body() {
            if (cursor.check(TokenType.LBRACE)) {
                block();
            } else if (!cursor.isAtEnd()) {
                statement();
            }
        }

        private void block() {
            symbols.enterScope();
            cursor.advance();
            statementsUntilBrace();
            expect(TokenType.RBRACE, "Expected '}' to close block.");
            symbols.exitScope();
        }

        private void statementsUntilBrace() {
            while (!cursor.isAtEnd() && !cursor.check(TokenType.RBRACE)) {
                int start = cursor.position();
                statement();
                if (cursor.position() == start) {
                    cursor.advance();
                }
            }
        }

        /**
         * Walks an expression and reports every identifier that is not
         * declared. In a condition the walk stops at the closing
         * parenthesis, otherwise at the statement end.
         *
         * @return true if an undeclared identifier was found
         */
        private boolean checkUses(boolean condition) {
            boolean undeclared = false;
            Token last = cursor.previous();
            int depth = 0;

            while (!cursor.isAtEnd()) {
                Token token = cursor.peek();
                if (token.is(TokenType.SEMICOLON) || token.is(TokenType.LBRACE) || token.is(TokenType.RBRACE))
                    break;
                if (token.is(TokenType.RPAREN)) {
                    if (depth == 0 && condition)
                        break;
                    depth--;
                } else if (token.is(TokenType.LPAREN)) {
                    depth++;
                }

                cursor.advance();
                // member names after '.' are not looked up
                if (token.is(TokenType.IDENTIFIER) && !last.is(TokenType.DOT) && !isDeclared(token.getLexeme())) {
                    error(String.format("Undeclared identifier '%s'", token.getLexeme()), token.getLine());
                    undeclared = true;
                }
                last = token;
            }
            return undeclared;
        }

        private boolean isDeclared(String name) {
            return symbols.exists(name) || options.isBuiltin(name);
        }

        private void expect(TokenType type, String message) {
            if (!cursor.match(type)) {
                error(message, cursor.peek().getLine());
            }
        }

        private void skipPast(TokenType type) {
            while (!cursor.isAtEnd() && !cursor.check(type)) {
                cursor.advance();
            }
            cursor.match(type);
        }

        private void skipLine(int line) {
            while (!cursor.isAtEnd() && cursor.peek().getLine() == line) {
                cursor.advance();
            }
        }

        private void error(String message, int line) {
            errors.add(new SemanticError(message, line, Severity.ERROR));
        }

        private void warning(String message, int line) {
            warnings.add(new SemanticError(message, line, Severity.WARNING));
        }
    }
}
