package com.complexity.analyzer.ast;

/**
 * A top-level {@code declare}/{@code let} line that precedes the main block.
 * Only the declared name and the raw text are kept.
 */
public class Declaration extends Node {

    private final String name;
    private final String text;

    public Declaration(String name, String text, int line, int column) {
        super(line, column);
        this.name = name;
        this.text = text;
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }
}
