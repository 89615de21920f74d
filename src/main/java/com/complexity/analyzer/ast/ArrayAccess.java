package com.complexity.analyzer.ast;

/**
 * {@code base[index]}. Multi-dimensional access {@code C[i, j]} nests as {@code (C[i])[j]}.
 */
public class ArrayAccess extends Expression {

    private final Expression base;
    private final Expression index;

    public ArrayAccess(Expression base, Expression index, int line, int column) {
        super(line, column);
        this.base = base;
        this.index = index;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitArrayAccess(this, arg);
    }
}
