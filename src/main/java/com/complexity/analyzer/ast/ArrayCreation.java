package com.complexity.analyzer.ast;

public class ArrayCreation extends Expression {

    private final Expression size;

    public ArrayCreation(Expression size, int line, int column) {
        super(line, column);
        this.size = size;
    }

    public Expression getSize() {
        return size;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitArrayCreation(this, arg);
    }
}
