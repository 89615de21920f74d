package com.complexity.analyzer.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Human-readable description of the accepted pseudocode grammar.
 * Used for documentation and the CLI's {@code --grammar} output; the parser does not read it.
 */
public final class GrammarRules {

    private static final Map<String, String> PRODUCTIONS = new LinkedHashMap<>();

    static {
        PRODUCTIONS.put("program",
                "class_def* declaration* [header] procedure* [main_block procedure*]");
        PRODUCTIONS.put("class_def", "'class' NAME '{' NAME* '}'");
        PRODUCTIONS.put("declaration", "('declare' | 'let') <rest of line>");
        PRODUCTIONS.put("header", "('algorithm' | 'algoritmo') NAME");
        PRODUCTIONS.put("procedure",
                "[procedure_kw] NAME '(' [param {',' param}] ')' ['returns' TYPE] main_block");
        PRODUCTIONS.put("param", "NAME ['[' ... ']' ['..' '[' ... ']']]");
        PRODUCTIONS.put("main_block", "'begin' statement* 'end'");
        PRODUCTIONS.put("block", "main_block | statement* ['end']");
        PRODUCTIONS.put("statement",
                "for | while | repeat | if | call | swap | return | print | tolerated | assignment");
        PRODUCTIONS.put("for", "'for' NAME ASSIGN expr ('to' | 'downto') expr 'do' block");
        PRODUCTIONS.put("while", "'while' expr 'do' block");
        PRODUCTIONS.put("repeat", "'repeat' statement* 'until' expr");
        PRODUCTIONS.put("if", "'if' expr 'then' block ['else' (if | block)]");
        PRODUCTIONS.put("call", "'call' NAME '(' args ')' | NAME '(' args ')'");
        PRODUCTIONS.put("swap", "'swap' expr 'with' expr");
        PRODUCTIONS.put("return", "'return' [expr on the same line]");
        PRODUCTIONS.put("print", "'print' expr");
        PRODUCTIONS.put("tolerated", "('let' | 'declare') <rest of line>");
        PRODUCTIONS.put("assignment", "lvalue (ASSIGN | '=') expr");
        PRODUCTIONS.put("lvalue", "NAME {'[' expr {',' expr} ']' | '.' NAME}");
        PRODUCTIONS.put("expr", "or ['..' or]");
        PRODUCTIONS.put("or", "and {'or' and}");
        PRODUCTIONS.put("and", "equality {'and' equality}");
        PRODUCTIONS.put("equality", "comparison {('=' | '<>') comparison}");
        PRODUCTIONS.put("comparison", "additive {('<' | '>' | '<=' | '>=') additive}");
        PRODUCTIONS.put("additive", "term {('+' | '-') term}");
        PRODUCTIONS.put("term", "unary {('*' | '/' | '%' | 'mod' | 'div') unary}");
        PRODUCTIONS.put("unary", "('-' | '+' | 'not') unary | primary");
        PRODUCTIONS.put("primary",
                "NUMBER | STRING | 'null' | 'true' | 'false' | 'length' '(' NAME ')' "
                        + "| 'call' NAME '(' args ')' | 'new' ['array'] '[' expr ']' "
                        + "| NAME postfix* | '(' expr ')'");
        PRODUCTIONS.put("postfix", "'[' expr {',' expr} ']' | '.' NAME | '(' args ')'");
    }

    private static final Map<String, List<String>> ACCEPTED_LEXEMES = new LinkedHashMap<>();

    static {
        ACCEPTED_LEXEMES.put("ASSIGN", List.of(Token.ASSIGN, "←", "↨", "<-", ":="));
        ACCEPTED_LEXEMES.put("<=", List.of("<=", "≤"));
        ACCEPTED_LEXEMES.put(">=", List.of(">=", "≥"));
        ACCEPTED_LEXEMES.put("<>", List.of("<>", "≠", "!="));
        ACCEPTED_LEXEMES.put("comment", List.of("► to end of line"));
    }

    private GrammarRules() {
    }

    public static Map<String, String> productions() {
        return Collections.unmodifiableMap(PRODUCTIONS);
    }

    /**
     * @return canonical token to the source spellings that lex to it
     */
    public static Map<String, List<String>> acceptedLexemes() {
        return Collections.unmodifiableMap(ACCEPTED_LEXEMES);
    }

    public static List<String> reservedWords() {
        return new ArrayList<>(new TreeSet<>(Lexer.RESERVED_WORDS));
    }

    /**
     * Renders the grammar as a Markdown document.
     */
    public static String toMarkdown() {
        StringBuilder markdown = new StringBuilder();
        markdown.append("# Pseudocode grammar\n\n## Productions\n\n```\n");
        for (Map.Entry<String, String> production : PRODUCTIONS.entrySet()) {
            markdown.append(String.format("%-11s := %s%n", production.getKey(), production.getValue()));
        }
        markdown.append("```\n\n## Accepted spellings\n\n");
        for (Map.Entry<String, List<String>> entry : ACCEPTED_LEXEMES.entrySet()) {
            markdown.append("- `").append(entry.getKey()).append("`: ")
                    .append(String.join(", ", entry.getValue())).append('\n');
        }
        markdown.append("\n## Reserved words\n\n")
                .append(String.join(" ", reservedWords()))
                .append('\n');
        return markdown.toString();
    }
}
