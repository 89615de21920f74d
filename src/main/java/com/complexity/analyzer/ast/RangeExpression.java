package com.complexity.analyzer.ast;

/**
 * {@code start..end}, as used in array slices like {@code A[1..mid]}.
 */
public class RangeExpression extends Expression {

    private final Expression start;
    private final Expression end;

    public RangeExpression(Expression start, Expression end, int line, int column) {
        super(line, column);
        this.start = start;
        this.end = end;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitRangeExpression(this, arg);
    }
}
