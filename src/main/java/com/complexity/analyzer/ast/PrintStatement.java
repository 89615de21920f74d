package com.complexity.analyzer.ast;

public class PrintStatement extends Statement {

    private final Expression expression;

    public PrintStatement(Expression expression, int line, int column) {
        super(line, column);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitPrintStatement(this, arg);
    }
}
