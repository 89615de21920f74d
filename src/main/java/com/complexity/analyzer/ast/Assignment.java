package com.complexity.analyzer.ast;

public class Assignment extends Statement {

    private final Expression target;
    private final Expression value;

    public Assignment(Expression target, Expression value, int line, int column) {
        super(line, column);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitAssignment(this, arg);
    }
}
