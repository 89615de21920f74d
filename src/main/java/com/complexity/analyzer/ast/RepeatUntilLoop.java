package com.complexity.analyzer.ast;

import java.util.List;

public class RepeatUntilLoop extends Statement {

    private final List<Statement> body;
    private final Expression condition;

    public RepeatUntilLoop(List<Statement> body, Expression condition, int line, int column) {
        super(line, column);
        this.body = List.copyOf(body);
        this.condition = condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    /**
     * @return the exit condition checked after each pass
     */
    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitRepeatUntilLoop(this, arg);
    }
}
