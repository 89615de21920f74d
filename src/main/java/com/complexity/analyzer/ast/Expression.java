package com.complexity.analyzer.ast;

/**
 * A pseudocode expression. Every concrete expression dispatches through {@link ExpressionVisitor}.
 */
public abstract class Expression extends Node {

    protected Expression(int line, int column) {
        super(line, column);
    }

    public abstract <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg);
}
