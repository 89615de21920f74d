package com.complexity.analyzer.ast;

public class ReturnStatement extends Statement {

    private final Expression value;

    public ReturnStatement(Expression value, int line, int column) {
        super(line, column);
        this.value = value;
    }

    /**
     * @return the returned expression, or null for a bare {@code return}
     */
    public Expression getValue() {
        return value;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitReturnStatement(this, arg);
    }
}
