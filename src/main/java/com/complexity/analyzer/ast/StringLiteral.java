package com.complexity.analyzer.ast;

public class StringLiteral extends Expression {

    private final String value;

    public StringLiteral(String value, int line, int column) {
        super(line, column);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitStringLiteral(this, arg);
    }
}
