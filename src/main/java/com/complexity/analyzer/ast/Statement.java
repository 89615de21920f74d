package com.complexity.analyzer.ast;

/**
 * A pseudocode statement. Every concrete statement dispatches through {@link StatementVisitor}.
 */
public abstract class Statement extends Node {

    protected Statement(int line, int column) {
        super(line, column);
    }

    public abstract <R, A> R accept(StatementVisitor<R, A> visitor, A arg);
}
