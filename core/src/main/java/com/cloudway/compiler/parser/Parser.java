/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.cloudway.compiler.grammar.Grammar;
import com.cloudway.compiler.grammar.ParseTree;
import com.cloudway.compiler.grammar.Production;
import com.cloudway.compiler.lexer.Token;
import com.cloudway.compiler.lexer.TokenCursor;

/**
 * Recursive descent parser for the expression grammar
 *
 * <pre>
 *   E  → T E'
 *   E' → + T E' | ε
 *   T  → F T'
 *   T' → * F T' | ε
 *   F  → ( E ) | id | num
 * </pre>
 *
 * The parser always recognizes this grammar. The {@link Grammar} given to
 * it only supplies the name of the resulting tree.
 *
 * <p>Errors do not stop the parse: the offending construct is recorded
 * and parsing continues, producing a partial tree.</p>
 */
public class Parser
{
    private static final Logger logger = Logger.getLogger(Parser.class.getName());

    /**
     * The deepest parenthesized group the parser descends into.
     */
    public static final int MAX_NESTING = 500;

    private final Grammar grammar;

    public Parser() {
        this(Grammar.expression());
    }

    public Parser(Grammar grammar) {
        this.grammar = requireNonNull(grammar);
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public ParseResult parse(List<Token> tokens) {
        Run run = new Run(new TokenCursor(tokens), new ParseTree(grammar.getName()));
        ParseResult result = run.parse();
        logger.fine(() -> String.format("Parsed %d tokens into %d nodes with %d errors",
                                        tokens.size(), result.getTree().size(), result.getErrors().size()));
        return result;
    }

    /**
     * The state of a single parse.
     */
    private static final class Run {
        private final TokenCursor cursor;
        private final ParseTree tree;
        private final List<ParseError> errors = new ArrayList<>();
        private int nesting;

        Run(TokenCursor cursor, ParseTree tree) {
            this.cursor = cursor;
            this.tree = tree;
        }

        ParseResult parse() {
            if (cursor.size() == 0) {
                error("Empty token stream", "tokens");
                return new ParseResult(tree, errors);
            }

            tree.setRoot(parseE());

            if (!cursor.isAtEnd()) {
                error("Unexpected token after expression", "EOF");
            }
            return new ParseResult(tree, errors);
        }

        // E → T E'
        private int parseE() {
            int node = tree.addNonTerminal("E");
            tree.addChild(node, parseT());
            tree.addChild(node, parseEPrime());
            return node;
        }

        // E' → + T E' | ε
        private int parseEPrime() {
            int first = tree.addNonTerminal("E'");
            int node = first;
            while (check("+", "PLUS")) {
                cursor.advance();
                tree.addChild(node, tree.addTerminal("+", "+"));
                tree.addChild(node, parseT());
                int next = tree.addNonTerminal("E'");
                tree.addChild(node, next);
                node = next;
            }
            tree.addChild(node, epsilon());
            return first;
        }

        // T → F T'
        private int parseT() {
            int node = tree.addNonTerminal("T");
            tree.addChild(node, parseF());
            tree.addChild(node, parseTPrime());
            return node;
        }

        // T' → * F T' | ε
        private int parseTPrime() {
            int first = tree.addNonTerminal("T'");
            int node = first;
            while (check("*", "MULTIPLY")) {
                cursor.advance();
                tree.addChild(node, tree.addTerminal("*", "*"));
                tree.addChild(node, parseF());
                int next = tree.addNonTerminal("T'");
                tree.addChild(node, next);
                node = next;
            }
            tree.addChild(node, epsilon());
            return first;
        }

        // F → ( E ) | id | num
        private int parseF() {
            int node = tree.addNonTerminal("F");
            if (check("(", "LPAREN") && nesting >= MAX_NESTING) {
                error("Expression nested too deeply", "id | num");
                skipGroup();
            } else if (check("(", "LPAREN")) {
                cursor.advance();
                tree.addChild(node, tree.addTerminal("(", "("));
                nesting++;
                tree.addChild(node, parseE());
                nesting--;
                if (check(")", "RPAREN")) {
                    cursor.advance();
                    tree.addChild(node, tree.addTerminal(")", ")"));
                } else {
                    error("Expected ')'", ")");
                }
            } else if (check("id", "IDENTIFIER")) {
                tree.addChild(node, tree.addTerminal("id", cursor.advance().getLexeme()));
            } else if (check("num", "INTEGER", "INTEGER_LITERAL", "FLOAT", "FLOAT_LITERAL")) {
                tree.addChild(node, tree.addTerminal("num", cursor.advance().getLexeme()));
            } else {
                error("Expected '(', identifier, or number", "id | num | (");
            }
            return node;
        }

        /**
         * Moves past a parenthesized group and everything nested in it.
         */
        private void skipGroup() {
            int open = 0;
            do {
                if (check("(", "LPAREN")) {
                    open++;
                } else if (check(")", "RPAREN")) {
                    open--;
                }
                cursor.advance();
            } while (open > 0 && !cursor.isAtEnd());
        }

        private int epsilon() {
            return tree.addTerminal(Production.EPSILON, Production.EPSILON);
        }

        /**
         * Matches the current token by type name or by lexeme.
         */
        private boolean check(String... expected) {
            if (cursor.isAtEnd()) {
                return false;
            }
            Token token = cursor.peek();
            for (String e : expected) {
                if (e.equals(token.getTypeName()) || e.equals(token.getType().name()) || e.equals(token.getLexeme())) {
                    return true;
                }
            }
            return false;
        }

        private void error(String message, String expected) {
            errors.add(new ParseError(message, cursor.position(), expected, found()));
        }

        private String found() {
            if (cursor.isAtEnd()) {
                return "EOF";
            }
            Token token = cursor.peek();
            return String.format("%s ('%s')", token.getTypeName(), token.getLexeme());
        }
    }
}
