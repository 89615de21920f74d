package com.complexity.analyzer.ast;

public class NullLiteral extends Expression {

    public NullLiteral(int line, int column) {
        super(line, column);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitNullLiteral(this, arg);
    }
}
