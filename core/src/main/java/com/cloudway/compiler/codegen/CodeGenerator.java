/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;

import com.cloudway.compiler.lexer.Token;
import com.cloudway.compiler.lexer.TokenCursor;
import com.cloudway.compiler.lexer.TokenType;
import com.cloudway.compiler.semantic.SemanticAnalyzer;
import com.cloudway.compiler.semantic.Symbol;
import com.cloudway.compiler.semantic.SymbolTable;
import com.cloudway.compiler.semantic.SymbolType;

import static com.cloudway.compiler.codegen.FailureKind.*;

/**
 * Syntax directed translation of a token stream into Python, Java,
 * JavaScript or a small x86 assembly subset.
 *
 * <p>Statements are recognized directly on the tokens, one at a time.
 * A statement that cannot be translated is replaced by a comment of the
 * form {@code # [skipped: reason]} and generation resumes at the next
 * statement, so the whole stream is always processed. Each call works on
 * its own state; one generator may serve several targets.</p>
 */
public class CodeGenerator
{
    private static final Logger logger = Logger.getLogger(CodeGenerator.class.getName());

    private static final ImmutableMap<String, String> JAVA_TYPES = ImmutableMap.of(
        "string", "String",
        "bool", "boolean");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final GeneratorOptions options;

    public CodeGenerator() {
        this(GeneratorOptions.defaults());
    }

    public CodeGenerator(GeneratorOptions options) {
        this.options = requireNonNull(options);
    }

    public GeneratorOptions getOptions() {
        return options;
    }

    /**
     * Translates tokens for the configured target.
     */
    public String generate(List<Token> tokens, SymbolTable symbols) {
        return generateWithReport(tokens, symbols, options.getTarget()).getCode();
    }

    public String generate(List<Token> tokens, SymbolTable symbols, TargetLanguage target) {
        return generateWithReport(tokens, symbols, target).getCode();
    }

    /**
     * Translates tokens and reports the statements that were skipped.
     *
     * @param symbols the table produced by semantic analysis, used for
     *        typed input and assembly storage; may be null
     */
    public GenerationResult generateWithReport(List<Token> tokens, SymbolTable symbols, TargetLanguage target) {
        requireNonNull(target);
        TokenCursor cursor = new TokenCursor(ConstantFolder.fold(tokens));
        Session session = new Session(cursor, symbols != null ? symbols : new SymbolTable(), target, options);
        GenerationResult result = session.run();
        logger.fine(() -> String.format("Generated %s code from %d tokens, %d statements skipped",
                                        target, tokens.size(), result.getSkipped().size()));
        return result;
    }

    /**
     * The state of a single translation.
     */
    private static final class Session {
        private final TokenCursor cursor;
        private final SymbolTable symbols;
        private final TargetLanguage target;
        private final GeneratorOptions options;
        private final boolean python;

        private final StringBuilder out = new StringBuilder();
        private final List<StatementResult> skipped = new ArrayList<>();
        private int depth;
        private int nesting;
        private int codeLines;
        private int functionDepth;
        private boolean javaMain;
        private boolean scannerDeclared;
        private boolean mainDefined;

        // update clause of each enclosing loop, innermost first
        private final Deque<Optional<String>> loopUpdates = new ArrayDeque<>();

        Session(TokenCursor cursor, SymbolTable symbols, TargetLanguage target, GeneratorOptions options) {
            this.cursor = cursor;
            this.symbols = symbols;
            this.target = target;
            this.options = options;
            this.python = target == TargetLanguage.PYTHON;
        }

        GenerationResult run() {
            if (target == TargetLanguage.ASSEMBLY) {
                return new GenerationResult(target, assembly(), skipped);
            }

            boolean preamble = options.isPreamble();
            if (preamble)
                header();
            statements(false);
            if (preamble)
                footer();
            return new GenerationResult(target, out.toString(), skipped);
        }

        private void header() {
            switch (target) {
            case PYTHON:
                out.append("# Generated Python Code\n\n");
                break;
            case JAVASCRIPT:
                out.append("// Generated JavaScript Code\n\n");
                break;
            case JAVA:
                out.append("// Generated Java Code\n");
                out.append("import java.util.*;\n\n");
                out.append("public class Main {\n");
                depth++;
                break;
            default:
                break;
            }
        }

        private void footer() {
            switch (target) {
            case PYTHON:
                if (mainDefined)
                    out.append("if __name__ == \"__main__\":\n").append(indent(1)).append("main()\n");
                break;
            case JAVASCRIPT:
                if (mainDefined)
                    out.append("main();\n");
                break;
            case JAVA:
                depth--;
                out.append("}\n");
                break;
            default:
                break;
            }
        }

        // Statement loop and recovery

        private void statements(boolean untilBrace) {
            while (!cursor.isAtEnd() && !(untilBrace && cursor.check(TokenType.RBRACE))) {
                guarded(this::statement);
            }
        }

        /**
         * Runs one translation step. A failed step has its partial output
         * discarded and is replaced by a skipped marker, then the cursor
         * moves on to the next statement.
         */
        private void guarded(Supplier<StatementResult> step) {
            if (nesting >= SemanticAnalyzer.MAX_NESTING) {
                report(failed(UNSUPPORTED_EXPRESSION, "Statements nested too deeply"));
                cursor.skipStatement();
                return;
            }

            int start = cursor.position();
            int mark = out.length();
            int lines = codeLines;

            nesting++;
            StatementResult result = step.get();
            nesting--;
            if (!result.isOk()) {
                out.setLength(mark);
                codeLines = lines;
                skip(result);
            }
            if (cursor.position() == start) {
                cursor.advance();
            }
        }

        private void skip(StatementResult result) {
            report(result);
            skipToNextStatement();
        }

        private void report(StatementResult result) {
            logger.warning(() -> "Statement skipped: " + result);
            skipped.add(result);
            comment("[skipped: " + result.getMessage() + "]");
        }

        /**
         * Moves past the next statement terminator. Stops in front of a
         * brace so block structure is preserved.
         */
        private void skipToNextStatement() {
            while (!cursor.isAtEnd()
                    && !cursor.check(TokenType.SEMICOLON)
                    && !cursor.check(TokenType.LBRACE)
                    && !cursor.check(TokenType.RBRACE)) {
                cursor.advance();
            }
            cursor.match(TokenType.SEMICOLON);
        }

        private StatementResult failed(FailureKind kind, String message) {
            return StatementResult.failed(kind, message, cursor.peek().getLine());
        }

        private StatementResult statement() {
            Token token = cursor.peek();

            switch (token.getType()) {
            case UNKNOWN:
                if (token.getLexeme().equals("#"))
                    return directive();
                return failed(UNEXPECTED_TOKEN, "Unexpected token '" + token.getLexeme() + "'");

            case COMMENT:
                cursor.advance();
                String text = token.getLexeme();
                if (python && text.startsWith("//"))
                    text = "#" + text.substring(2);
                out.append(indent()).append(text).append('\n');
                return StatementResult.ok();

            case SEMICOLON:
                cursor.advance();
                return StatementResult.ok();

            case LBRACE:
                return bareBlock();

            case RBRACE:
                return failed(UNEXPECTED_TOKEN, "Unexpected '}'");

            case KEYWORD:
                return keywordStatement(token.getLexeme().toLowerCase(Locale.ROOT));

            case IDENTIFIER:
                switch (token.getLexeme()) {
                case "using":
                    if (cursor.peek(1).getLexeme().equals("namespace")) {
                        skipToNextStatement();
                        return StatementResult.ok();
                    }
                    break;
                case "cout":
                    return output();
                case "cin":
                    return input();
                default:
                    if (SemanticAnalyzer.isTypeKeyword(token.getLexeme()))
                        return typedStatement(false);
                    break;
                }
                return identifierStatement();

            default:
                return failed(UNEXPECTED_TOKEN, "Unexpected token '" + token.getLexeme() + "'");
            }
        }

        private StatementResult keywordStatement(String keyword) {
            if (SemanticAnalyzer.isTypeKeyword(keyword))
                return typedStatement(false);

            switch (keyword) {
            case "const":
                cursor.advance();
                if (!SemanticAnalyzer.isTypeKeyword(cursor.peek().getLexeme()))
                    return failed(UNEXPECTED_TOKEN, "Expected type after 'const'");
                return typedStatement(true);
            case "if":
                return conditional();
            case "while":
                return whileLoop();
            case "for":
                return forLoop();
            case "return":
                return returnStatement();
            case "break":
            case "continue":
                cursor.advance();
                cursor.match(TokenType.SEMICOLON);
                if (keyword.equals("continue") && !loopUpdates.isEmpty() && loopUpdates.peek().isPresent())
                    line(loopUpdates.peek().get());
                line(keyword + end());
                return StatementResult.ok();
            case "else":
                return failed(UNEXPECTED_TOKEN, "'else' without 'if'");
            default:
                return failed(UNEXPECTED_TOKEN, "Unsupported statement '" + keyword + "'");
            }
        }

        private StatementResult typedStatement(boolean constant) {
            if (cursor.peek(1).is(TokenType.IDENTIFIER) && cursor.peek(2).is(TokenType.LPAREN))
                return function();
            return declaration(constant);
        }

        // Declarations and assignments

        private StatementResult declaration(boolean constant) {
            Token type = cursor.advance();
            if (!cursor.check(TokenType.IDENTIFIER))
                return failed(MISSING_IDENTIFIER, "Missing identifier after type '" + type.getLexeme() + "'");
            String name = cursor.advance().getLexeme();

            String init = null;
            if (cursor.match(TokenType.ASSIGN)) {
                List<Token> expr = expression();
                if (expr.isEmpty())
                    return failed(INCOMPLETE_STATEMENT, "Expected value after '='");
                StatementResult check = validate(expr, false);
                if (!check.isOk())
                    return check;
                init = TokenText.render(expr, target);
            }
            cursor.match(TokenType.SEMICOLON);

            StringBuilder decl = new StringBuilder();
            switch (target) {
            case PYTHON:
                decl.append(name).append(" = ").append(init != null ? init : "None");
                break;
            case JAVA:
                if (options.isPreamble() && functionDepth == 0)
                    decl.append("static ");
                if (constant)
                    decl.append("final ");
                decl.append(javaType(type.getLexeme())).append(' ').append(name);
                break;
            default:
                decl.append(constant ? "const " : "let ").append(name);
                break;
            }
            if (!python && init != null)
                decl.append(" = ").append(init);
            line(decl + end());
            return StatementResult.ok();
        }

        private StatementResult identifierStatement() {
            Token id = cursor.peek();
            Token next = cursor.peek(1);

            if ((next.is(TokenType.INCREMENT) || next.is(TokenType.DECREMENT))
                    && (cursor.peek(2).is(TokenType.SEMICOLON) || cursor.peek(2).is(TokenType.END_OF_FILE))) {
                cursor.advance();
                cursor.advance();
                cursor.match(TokenType.SEMICOLON);
                line(step(id, next));
                return StatementResult.ok();
            }

            if (next.is(TokenType.ASSIGN) || next.is(TokenType.PLUS_ASSIGN) || next.is(TokenType.MINUS_ASSIGN)) {
                cursor.advance();
                cursor.advance();
                List<Token> expr = expression();
                if (expr.isEmpty())
                    return failed(INCOMPLETE_STATEMENT, "Expected value after '" + next.getLexeme() + "'");
                StatementResult check = validate(expr, false);
                if (!check.isOk())
                    return check;
                cursor.match(TokenType.SEMICOLON);
                line(id.getLexeme() + " " + next.getLexeme() + " " + TokenText.render(expr, target) + end());
                return StatementResult.ok();
            }

            // calls and other expression statements are copied through
            List<Token> expr = expression();
            StatementResult check = validate(expr, false);
            if (!check.isOk())
                return check;
            cursor.match(TokenType.SEMICOLON);
            line(TokenText.render(expr, target) + end());
            return StatementResult.ok();
        }

        private String step(Token id, Token op) {
            if (python)
                return id.getLexeme() + (op.is(TokenType.INCREMENT) ? " += 1" : " -= 1");
            return id.getLexeme() + op.getLexeme() + ";";
        }

        private StatementResult returnStatement() {
            cursor.advance();
            List<Token> expr = expression();
            StatementResult check = validate(expr, false);
            if (!check.isOk())
                return check;
            cursor.match(TokenType.SEMICOLON);

            if (expr.isEmpty() || javaMain) {
                line("return" + end());
            } else {
                line("return " + TokenText.render(expr, target) + end());
            }
            return StatementResult.ok();
        }

        // Stream input and output

        private StatementResult output() {
            cursor.advance();
            List<String> parts = new ArrayList<>();
            boolean newline = false;

            while (!cursor.isAtEnd() && !cursor.check(TokenType.SEMICOLON) && !cursor.check(TokenType.RBRACE)) {
                if (cursor.match(TokenType.SHIFT_LEFT))
                    continue;
                if (cursor.check(TokenType.IDENTIFIER, "endl")) {
                    cursor.advance();
                    if (cursor.check(TokenType.SEMICOLON) || cursor.isAtEnd()) {
                        newline = true;
                    } else {
                        parts.add("\"\\n\"");
                    }
                    continue;
                }

                List<Token> part = new ArrayList<>();
                int nesting = 0;
                while (!cursor.isAtEnd() && !cursor.check(TokenType.SEMICOLON) && !cursor.check(TokenType.RBRACE)
                        && !(nesting == 0 && cursor.check(TokenType.SHIFT_LEFT))) {
                    Token t = cursor.advance();
                    if (t.is(TokenType.LPAREN))
                        nesting++;
                    else if (t.is(TokenType.RPAREN))
                        nesting--;
                    part.add(t);
                }
                StatementResult check = validate(part, false);
                if (!check.isOk())
                    return check;
                parts.add(TokenText.render(part, target));
            }
            cursor.match(TokenType.SEMICOLON);

            switch (target) {
            case PYTHON:
                List<String> args = new ArrayList<>(parts);
                if (!newline)
                    args.add("end=\"\"");
                line("print(" + Joiner.on(", ").join(args) + ")");
                break;
            case JAVA:
                line("System.out." + (newline ? "println" : "print") + "(" + concat(parts) + ");");
                break;
            default:
                line("console.log(" + concat(parts) + ");");
                break;
            }
            return StatementResult.ok();
        }

        /**
         * Joins output parts with string concatenation, starting from a
         * string so numbers are not added together.
         */
        private static String concat(List<String> parts) {
            String joined = Joiner.on(" + ").join(parts);
            if (parts.size() > 1 && !parts.get(0).startsWith("\""))
                joined = "\"\" + " + joined;
            return joined;
        }

        private StatementResult input() {
            cursor.advance();
            List<Token> vars = new ArrayList<>();

            while (!cursor.isAtEnd() && !cursor.check(TokenType.SEMICOLON) && !cursor.check(TokenType.RBRACE)) {
                if (cursor.match(TokenType.SHIFT_RIGHT))
                    continue;
                if (!cursor.check(TokenType.IDENTIFIER))
                    return failed(UNEXPECTED_TOKEN, "Unexpected token '" + cursor.peek().getLexeme() + "' in input statement");
                vars.add(cursor.advance());
            }
            if (vars.isEmpty())
                return failed(INCOMPLETE_STATEMENT, "Expected variable after '>>'");
            cursor.match(TokenType.SEMICOLON);

            for (Token var : vars) {
                String name = var.getLexeme();
                SymbolType type = typeOf(name);
                switch (target) {
                case PYTHON:
                    line(name + " = " + pythonRead(type));
                    break;
                case JAVA:
                    if (!scannerDeclared) {
                        line("Scanner scanner = new Scanner(System.in);");
                        scannerDeclared = true;
                    }
                    line(name + " = " + javaRead(type) + ";");
                    break;
                default:
                    comment(name + " = readline() (Node.js requires the 'readline' module)");
                    break;
                }
            }
            return StatementResult.ok();
        }

        private SymbolType typeOf(String name) {
            Optional<Symbol> symbol = symbols.lookup(name);
            if (!symbol.isPresent()) {
                symbol = symbols.getDiscoveredSymbols().stream()
                    .filter(s -> s.getName().equals(name))
                    .findFirst();
            }
            return symbol.map(Symbol::getType).orElse(SymbolType.UNKNOWN);
        }

        private static String pythonRead(SymbolType type) {
            switch (type) {
            case INTEGER:
                return "int(input())";
            case FLOAT:
            case DOUBLE:
                return "float(input())";
            default:
                return "input()";
            }
        }

        private static String javaRead(SymbolType type) {
            switch (type) {
            case INTEGER:
                return "scanner.nextInt()";
            case FLOAT:
                return "scanner.nextFloat()";
            case DOUBLE:
                return "scanner.nextDouble()";
            case BOOLEAN:
                return "scanner.nextBoolean()";
            case CHAR:
                return "scanner.next().charAt(0)";
            default:
                return "scanner.next()";
            }
        }

        private StatementResult directive() {
            int line = cursor.advance().getLine();
            List<Token> rest = new ArrayList<>();
            while (!cursor.isAtEnd() && cursor.peek().getLine() == line) {
                rest.add(cursor.advance());
            }

            if (rest.isEmpty() || !rest.get(0).getLexeme().equals("include")) {
                List<String> words = new ArrayList<>();
                rest.forEach(t -> words.add(t.getLexeme()));
                comment("Directive not translated: #" + Joiner.on(' ').join(words));
                return StatementResult.ok();
            }

            StringBuilder header = new StringBuilder();
            for (Token t : rest.subList(1, rest.size())) {
                if (t.is(TokenType.STRING_LITERAL)) {
                    String s = t.getLexeme();
                    header.append(s, 1, s.length() - 1);
                } else if (!t.is(TokenType.LESS_THAN) && !t.is(TokenType.GREATER_THAN)) {
                    header.append(t.getLexeme());
                }
            }
            comment(includeNote(header.toString()));
            return StatementResult.ok();
        }

        private String includeNote(String header) {
            switch (header) {
            case "iostream":
                switch (target) {
                case JAVA:
                    return "C++ <iostream> is handled by System.out and java.util.Scanner";
                case PYTHON:
                    return "C++ <iostream> is equivalent to standard input/output functions like print() and input()";
                default:
                    return "C++ <iostream> is equivalent to console.log() and prompt() or process.stdin";
                }
            case "string":
                return target == TargetLanguage.JAVA
                    ? "C++ <string> corresponds to the built-in String class"
                    : "C++ <string> corresponds to the built-in string type";
            default:
                return "C++ <" + header + "> has no direct equivalent";
            }
        }

        // Functions and blocks

        private StatementResult function() {
            Token returnType = cursor.advance();
            String name = cursor.advance().getLexeme();
            cursor.advance(); // '('

            List<String> params = new ArrayList<>();
            while (!cursor.isAtEnd() && !cursor.check(TokenType.RPAREN)) {
                if (!SemanticAnalyzer.isTypeKeyword(cursor.peek().getLexeme()))
                    return failed(UNEXPECTED_TOKEN, "Unexpected token '" + cursor.peek().getLexeme() + "' in parameter list");
                Token paramType = cursor.advance();
                if (cursor.check(TokenType.IDENTIFIER)) {
                    String paramName = cursor.advance().getLexeme();
                    params.add(target == TargetLanguage.JAVA ? javaType(paramType.getLexeme()) + " " + paramName : paramName);
                } else if (!(paramType.getLexeme().equals("void") && cursor.check(TokenType.RPAREN))) {
                    return failed(MISSING_IDENTIFIER, "Missing parameter name after type '" + paramType.getLexeme() + "'");
                }
                if (!cursor.check(TokenType.RPAREN) && !cursor.match(TokenType.COMMA))
                    return failed(UNEXPECTED_TOKEN, "Expected ',' or ')' in parameter list");
            }
            if (!cursor.match(TokenType.RPAREN))
                return failed(INCOMPLETE_STATEMENT, "Expected ')' to close parameter list");
            if (!cursor.check(TokenType.LBRACE))
                return failed(INCOMPLETE_STATEMENT, "Expected '{' after function signature");

            String paramList = Joiner.on(", ").join(params);
            String signature;
            switch (target) {
            case PYTHON:
                signature = "def " + name + "(" + paramList + ")";
                break;
            case JAVA:
                if (name.equals("main")) {
                    signature = "public static void main(String[] args)";
                } else {
                    signature = "public static " + javaType(returnType.getLexeme()) + " " + name + "(" + paramList + ")";
                }
                break;
            default:
                signature = "function " + name + "(" + paramList + ")";
                break;
            }

            boolean outerMain = javaMain;
            functionDepth++;
            javaMain = target == TargetLanguage.JAVA && name.equals("main");
            scannerDeclared = false;

            body(signature, null);

            functionDepth--;
            javaMain = outerMain;
            scannerDeclared = false;
            mainDefined |= name.equals("main");
            out.append('\n');
            return StatementResult.ok();
        }

        /**
         * Emits a block header followed by a braced block or a single
         * statement. The tail, if any, is emitted as the last statement
         * inside the block.
         */
        private void body(String header, Runnable tail) {
            line(target.usesBraces() ? header + " {" : header + ":");
            depth++;
            int lines = codeLines;

            if (cursor.match(TokenType.LBRACE)) {
                statements(true);
                cursor.match(TokenType.RBRACE);
            } else if (!cursor.isAtEnd()) {
                guarded(this::statement);
            }
            if (tail != null)
                tail.run();

            if (python && codeLines == lines)
                line("pass");
            depth--;
            if (target.usesBraces())
                line("}");
        }

        /**
         * Emits a loop body. A present update is emitted as the last
         * statement of the body and again before every {@code continue}
         * of this loop.
         */
        private void loopBody(String header, Optional<String> update) {
            loopUpdates.push(update);
            body(header, update.isPresent() ? () -> line(update.get()) : null);
            loopUpdates.pop();
        }

        private StatementResult bareBlock() {
            cursor.advance();
            if (!target.usesBraces()) {
                statements(true);
            } else {
                line("{");
                depth++;
                statements(true);
                depth--;
                line("}");
            }
            cursor.match(TokenType.RBRACE);
            return StatementResult.ok();
        }

        // Control structures

        private StatementResult conditional() {
            StatementResult first = branch("if");
            if (!first.isOk())
                return first;

            while (cursor.check(TokenType.KEYWORD, "else")) {
                cursor.advance();
                if (!cursor.check(TokenType.KEYWORD, "if")) {
                    body("else", null);
                    break;
                }
                guarded(() -> branch(python ? "elif" : "else if"));
            }
            return StatementResult.ok();
        }

        private StatementResult branch(String keyword) {
            cursor.advance(); // 'if'
            Optional<List<Token>> cond = condition();
            if (!cond.isPresent())
                return failed(INCOMPLETE_STATEMENT, "Malformed condition after 'if'");
            StatementResult check = validate(cond.get(), false);
            if (!check.isOk())
                return check;

            body(header(keyword, cond.get()), null);
            return StatementResult.ok();
        }

        private StatementResult whileLoop() {
            cursor.advance();
            Optional<List<Token>> cond = condition();
            if (!cond.isPresent())
                return failed(INCOMPLETE_STATEMENT, "Malformed condition after 'while'");
            StatementResult check = validate(cond.get(), false);
            if (!check.isOk())
                return check;

            loopBody(header("while", cond.get()), Optional.empty());
            return StatementResult.ok();
        }

        private String header(String keyword, List<Token> cond) {
            String text = TokenText.render(cond, target);
            return python ? keyword + " " + text : keyword + " (" + text + ")";
        }

        /**
         * Reads a parenthesized condition, returning its inner tokens.
         */
        private Optional<List<Token>> condition() {
            if (!cursor.match(TokenType.LPAREN))
                return Optional.empty();
            List<Token> cond = until(TokenType.RPAREN);
            if (!cursor.match(TokenType.RPAREN))
                return Optional.empty();
            return Optional.of(cond);
        }

        private StatementResult forLoop() {
            cursor.advance();
            if (!cursor.match(TokenType.LPAREN))
                return failed(INCOMPLETE_STATEMENT, "Expected '(' after 'for'");
            List<Token> init = until(TokenType.SEMICOLON);
            if (!cursor.match(TokenType.SEMICOLON))
                return failed(INCOMPLETE_STATEMENT, "Expected ';' in for header");
            List<Token> cond = until(TokenType.SEMICOLON);
            if (!cursor.match(TokenType.SEMICOLON))
                return failed(INCOMPLETE_STATEMENT, "Expected ';' in for header");
            List<Token> update = until(TokenType.RPAREN);
            if (!cursor.match(TokenType.RPAREN))
                return failed(INCOMPLETE_STATEMENT, "Expected ')' after for header");

            StatementResult check = validate(init, false);
            if (check.isOk())
                check = validate(cond, false);
            if (check.isOk())
                check = validate(update, true);
            if (!check.isOk())
                return check;

            List<Token> assign = withoutType(init);
            if (!python) {
                String first = TokenText.render(assign, target);
                if (assign.size() < init.size()) {
                    first = (target == TargetLanguage.JAVA ? javaType(init.get(0).getLexeme()) : "let") + " " + first;
                }
                String second = TokenText.render(cond, target);
                String third = TokenText.render(update, target);
                loopBody("for (" + first + ";" + (second.isEmpty() ? "" : " " + second)
                             + ";" + (third.isEmpty() ? "" : " " + third) + ")", Optional.empty());
                return StatementResult.ok();
            }

            Optional<String> range = pythonRange(assign, cond, update);
            if (range.isPresent()) {
                loopBody("for " + assign.get(0).getLexeme() + " in " + range.get(), Optional.empty());
            } else {
                // no range equivalent, lower to a while loop
                if (!assign.isEmpty())
                    line(TokenText.render(assign, target));
                String test = cond.isEmpty() ? "True" : TokenText.render(cond, target);
                loopBody("while " + test, update.isEmpty() ? Optional.empty() : Optional.of(pythonUpdate(update)));
            }
            return StatementResult.ok();
        }

        private static List<Token> withoutType(List<Token> init) {
            if (!init.isEmpty() && SemanticAnalyzer.isTypeKeyword(init.get(0).getLexeme())
                    && init.size() > 1 && init.get(1).is(TokenType.IDENTIFIER)) {
                return init.subList(1, init.size());
            }
            return init;
        }

        /**
         * Converts a counting loop header to a {@code range(...)} call.
         * Only {@code i = a; i < b; i++} and its variants with {@code <=},
         * {@code >}, {@code >=}, {@code --} and {@code += n} qualify.
         */
        private Optional<String> pythonRange(List<Token> init, List<Token> cond, List<Token> update) {
            if (init.size() < 3 || !init.get(0).is(TokenType.IDENTIFIER) || !init.get(1).is(TokenType.ASSIGN))
                return Optional.empty();
            String var = init.get(0).getLexeme();
            String start = TokenText.render(init.subList(2, init.size()), target);

            if (cond.size() < 3 || !cond.get(0).is(TokenType.IDENTIFIER, var))
                return Optional.empty();
            TokenType relation = cond.get(1).getType();
            List<Token> bound = cond.subList(2, cond.size());

            Optional<Integer> step = stepOf(var, update);
            if (!step.isPresent())
                return Optional.empty();
            int by = step.get();

            String limit;
            if (by > 0 && relation == TokenType.LESS_THAN || by < 0 && relation == TokenType.GREATER_THAN) {
                limit = TokenText.render(bound, target);
            } else if (by > 0 && relation == TokenType.LESS_EQUAL) {
                limit = adjust(bound, 1);
            } else if (by < 0 && relation == TokenType.GREATER_EQUAL) {
                limit = adjust(bound, -1);
            } else {
                return Optional.empty();
            }

            return Optional.of("range(" + start + ", " + limit + (by != 1 ? ", " + by : "") + ")");
        }

        private Optional<Integer> stepOf(String var, List<Token> update) {
            if (update.size() == 2) {
                Token a = update.get(0), b = update.get(1);
                Token op = a.is(TokenType.IDENTIFIER, var) ? b : b.is(TokenType.IDENTIFIER, var) ? a : null;
                if (op != null && op.is(TokenType.INCREMENT))
                    return Optional.of(1);
                if (op != null && op.is(TokenType.DECREMENT))
                    return Optional.of(-1);
            } else if (update.size() == 3 && update.get(0).is(TokenType.IDENTIFIER, var)
                    && update.get(2).is(TokenType.INTEGER_LITERAL)) {
                Integer n = Ints.tryParse(update.get(2).getLexeme());
                if (n != null && n != 0 && update.get(1).is(TokenType.PLUS_ASSIGN))
                    return Optional.of(n);
                if (n != null && n != 0 && update.get(1).is(TokenType.MINUS_ASSIGN))
                    return Optional.of(-n);
            }
            return Optional.empty();
        }

        private String adjust(List<Token> bound, int delta) {
            if (bound.size() == 1 && bound.get(0).is(TokenType.INTEGER_LITERAL)) {
                Integer n = Ints.tryParse(bound.get(0).getLexeme());
                if (n != null)
                    return Integer.toString(n + delta);
            }
            return TokenText.render(bound, target) + (delta > 0 ? " + 1" : " - 1");
        }

        private String pythonUpdate(List<Token> update) {
            if (update.size() == 2) {
                Token a = update.get(0), b = update.get(1);
                Token id = a.is(TokenType.IDENTIFIER) ? a : b;
                Token op = a.is(TokenType.IDENTIFIER) ? b : a;
                if (id.is(TokenType.IDENTIFIER) && (op.is(TokenType.INCREMENT) || op.is(TokenType.DECREMENT)))
                    return step(id, op);
            }
            return TokenText.render(update, target);
        }

        // Token collection helpers

        /**
         * Collects the tokens of an expression statement up to, not
         * including, its terminator.
         */
        private List<Token> expression() {
            List<Token> tokens = new ArrayList<>();
            int nesting = 0;
            while (!cursor.isAtEnd()) {
                Token t = cursor.peek();
                if (t.is(TokenType.SEMICOLON) || t.is(TokenType.LBRACE) || t.is(TokenType.RBRACE))
                    break;
                if (t.is(TokenType.RPAREN) && nesting == 0)
                    break;
                if (t.is(TokenType.LPAREN))
                    nesting++;
                else if (t.is(TokenType.RPAREN))
                    nesting--;
                tokens.add(cursor.advance());
            }
            return tokens;
        }

        /**
         * Collects tokens up to the given delimiter at parenthesis depth
         * zero. Braces end the collection early.
         */
        private List<Token> until(TokenType delimiter) {
            List<Token> tokens = new ArrayList<>();
            int nesting = 0;
            while (!cursor.isAtEnd()) {
                Token t = cursor.peek();
                if (nesting == 0 && t.is(delimiter))
                    break;
                if (t.is(TokenType.LBRACE) || t.is(TokenType.RBRACE))
                    break;
                if (t.is(TokenType.LPAREN))
                    nesting++;
                else if (t.is(TokenType.RPAREN))
                    nesting--;
                tokens.add(cursor.advance());
            }
            return tokens;
        }

        private StatementResult validate(List<Token> tokens, boolean allowStep) {
            for (Token t : tokens) {
                if (t.is(TokenType.UNKNOWN))
                    return StatementResult.failed(UNEXPECTED_TOKEN, "Unexpected token '" + t.getLexeme() + "'", t.getLine());
                if (python && !allowStep && (t.is(TokenType.INCREMENT) || t.is(TokenType.DECREMENT)))
                    return StatementResult.failed(UNSUPPORTED_EXPRESSION,
                        "Operator '" + t.getLexeme() + "' inside an expression has no Python equivalent", t.getLine());
            }
            return StatementResult.ok();
        }

        // Output helpers

        private String indent() {
            return indent(depth);
        }

        private String indent(int level) {
            return Strings.repeat(" ", level * options.getIndent());
        }

        private String end() {
            return python ? "" : ";";
        }

        private void line(String text) {
            out.append(indent()).append(text).append('\n');
            codeLines++;
        }

        private void comment(String text) {
            out.append(indent()).append(target.getCommentPrefix()).append(' ').append(text).append('\n');
        }

        private static String javaType(String type) {
            String mapped = JAVA_TYPES.get(type.toLowerCase(Locale.ROOT));
            return mapped != null ? mapped : type;
        }

        // Assembly

        private String assembly() {
            StringBuilder data = new StringBuilder("section .data\n");
            StringBuilder bss = new StringBuilder("section .bss\n");
            Set<String> seen = new HashSet<>();

            for (Symbol symbol : symbols.getDiscoveredSymbols()) {
                if (symbol.getType() == SymbolType.FUNCTION || !seen.add(symbol.getName()))
                    continue;
                String value = symbol.getValue();
                if (symbol.isInitialized() && isLiteral(value)) {
                    data.append("    ").append(symbol.getName()).append(' ').append(storage(symbol.getType(), value)).append('\n');
                } else {
                    bss.append("    ").append(symbol.getName()).append(' ').append(reserve(symbol.getType())).append('\n');
                }
            }

            StringBuilder text = new StringBuilder("section .text\n    global _start\n\n_start:\n");
            boolean exited = false;

            while (!cursor.isAtEnd()) {
                Token token = cursor.peek();
                if (SemanticAnalyzer.isTypeKeyword(token.getLexeme()) && cursor.peek(1).is(TokenType.IDENTIFIER)) {
                    cursor.advance();
                    if (cursor.peek(1).is(TokenType.ASSIGN)) {
                        assemblyAssignment(text);
                    } else {
                        cursor.advance();
                    }
                } else if (token.is(TokenType.IDENTIFIER) && cursor.peek(1).is(TokenType.ASSIGN)) {
                    assemblyAssignment(text);
                } else if (token.is(TokenType.KEYWORD, "return")) {
                    exited |= assemblyReturn(text);
                } else {
                    cursor.advance();
                }
            }

            if (!exited) {
                text.append("    mov eax, 1\n    mov ebx, 0\n    int 0x80\n");
            }
            return data.toString() + bss + text;
        }

        // name = lhs [op rhs] ;
        private void assemblyAssignment(StringBuilder text) {
            Token name = cursor.advance();
            cursor.advance(); // '='
            List<Token> expr = expression();

            if (expr.size() == 1) {
                text.append("    ; ").append(name.getLexeme()).append(" = ").append(expr.get(0).getLexeme()).append('\n');
                text.append("    mov eax, ").append(operand(expr.get(0))).append('\n');
            } else if (expr.size() == 3 && arithmetic(expr.get(1)) != null) {
                Token lhs = expr.get(0), op = expr.get(1), rhs = expr.get(2);
                text.append("    ; ").append(name.getLexeme()).append(" = ").append(lhs.getLexeme())
                    .append(' ').append(op.getLexeme()).append(' ').append(rhs.getLexeme()).append('\n');
                text.append("    mov eax, ").append(operand(lhs)).append('\n');
                text.append("    ").append(arithmetic(op)).append(" eax, ").append(operand(rhs)).append('\n');
            } else {
                StatementResult result = StatementResult.failed(UNSUPPORTED_EXPRESSION,
                    "Expression too complex for assembly: " + name.getLexeme() + " = " + TokenText.render(expr, target),
                    name.getLine());
                skipAssembly(text, result);
                return;
            }
            text.append("    mov [").append(name.getLexeme()).append("], eax\n\n");
            cursor.match(TokenType.SEMICOLON);
        }

        private boolean assemblyReturn(StringBuilder text) {
            Token keyword = cursor.advance();
            List<Token> expr = expression();
            if (expr.size() > 1) {
                skipAssembly(text, StatementResult.failed(UNSUPPORTED_EXPRESSION,
                    "Return value too complex for assembly: " + TokenText.render(expr, target), keyword.getLine()));
                return false;
            }
            cursor.match(TokenType.SEMICOLON);

            String value = expr.isEmpty() ? "0" : expr.get(0).getLexeme();
            String operand = expr.isEmpty() ? "0" : operand(expr.get(0));
            text.append("    ; return ").append(value).append('\n');
            text.append("    mov eax, 1\n");
            text.append("    mov ebx, ").append(operand).append('\n');
            text.append("    int 0x80\n\n");
            return true;
        }

        private void skipAssembly(StringBuilder text, StatementResult result) {
            logger.warning(() -> "Statement skipped: " + result);
            skipped.add(result);
            text.append("    ; [skipped: ").append(result.getMessage()).append("]\n");
            skipToNextStatement();
        }

        private static String arithmetic(Token op) {
            switch (op.getType()) {
            case PLUS:
                return "add";
            case MINUS:
                return "sub";
            case MULTIPLY:
                return "imul";
            default:
                return null;
            }
        }

        private static String operand(Token token) {
            return token.is(TokenType.IDENTIFIER) ? "[" + token.getLexeme() + "]" : token.getLexeme();
        }

        private static boolean isLiteral(String value) {
            return value.startsWith("\"") || value.startsWith("'")
                || value.equals("true") || value.equals("false")
                || NUMBER.matcher(value).matches();
        }

        private static String storage(SymbolType type, String value) {
            switch (type) {
            case CHAR:
                return "db " + value;
            case STRING:
                return "db " + value + ", 0";
            case BOOLEAN:
                return "dd " + (value.equals("true") ? "1" : "0");
            default:
                return "dd " + value;
            }
        }

        private static String reserve(SymbolType type) {
            switch (type) {
            case CHAR:
                return "resb 1";
            case STRING:
                return "resb 256";
            default:
                return "resd 1";
            }
        }
    }
}
