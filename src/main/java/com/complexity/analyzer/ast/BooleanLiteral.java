package com.complexity.analyzer.ast;

public class BooleanLiteral extends Expression {

    private final boolean value;

    public BooleanLiteral(boolean value, int line, int column) {
        super(line, column);
        this.value = value;
    }

    public boolean isTrue() {
        return value;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitBooleanLiteral(this, arg);
    }
}
