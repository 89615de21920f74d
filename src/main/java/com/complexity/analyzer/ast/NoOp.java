package com.complexity.analyzer.ast;

/**
 * Placeholder for tolerated lines that carry no cost, such as {@code let} and {@code declare}.
 */
public class NoOp extends Statement {

    public NoOp(int line, int column) {
        super(line, column);
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitNoOp(this, arg);
    }
}
