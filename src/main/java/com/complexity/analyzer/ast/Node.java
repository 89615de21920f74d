package com.complexity.analyzer.ast;

/**
 * Base class of every syntax tree node.
 * Nodes are immutable and remember the source position they were parsed from.
 */
public abstract class Node {

    private final int line;
    private final int column;

    protected Node(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
