package com.complexity.analyzer.ast;

public class NumberLiteral extends Expression {

    private final long value;

    public NumberLiteral(long value, int line, int column) {
        super(line, column);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitNumberLiteral(this, arg);
    }
}
