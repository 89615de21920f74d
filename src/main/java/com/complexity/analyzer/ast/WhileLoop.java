package com.complexity.analyzer.ast;

import java.util.List;

public class WhileLoop extends Statement {

    private final Expression condition;
    private final List<Statement> body;

    public WhileLoop(Expression condition, List<Statement> body, int line, int column) {
        super(line, column);
        this.condition = condition;
        this.body = List.copyOf(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitWhileLoop(this, arg);
    }
}
