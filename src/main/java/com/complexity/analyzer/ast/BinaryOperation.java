package com.complexity.analyzer.ast;

/**
 * Binary operator application. Operators are kept as their canonical lexeme,
 * e.g. {@code +}, {@code div}, {@code <=}, {@code and}.
 */
public class BinaryOperation extends Expression {

    private final String operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperation(String operator, Expression left, Expression right, int line, int column) {
        super(line, column);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitBinaryOperation(this, arg);
    }
}
