package com.complexity.analyzer.ast;

public class FieldAccess extends Expression {

    private final Expression base;
    private final String field;

    public FieldAccess(Expression base, String field, int line, int column) {
        super(line, column);
        this.base = base;
        this.field = field;
    }

    public Expression getBase() {
        return base;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitFieldAccess(this, arg);
    }
}
