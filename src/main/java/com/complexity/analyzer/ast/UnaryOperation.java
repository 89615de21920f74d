package com.complexity.analyzer.ast;

public class UnaryOperation extends Expression {

    private final String operator;
    private final Expression operand;

    public UnaryOperation(String operator, Expression operand, int line, int column) {
        super(line, column);
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitUnaryOperation(this, arg);
    }
}
