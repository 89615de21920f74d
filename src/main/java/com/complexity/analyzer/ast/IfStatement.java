package com.complexity.analyzer.ast;

import java.util.List;

public class IfStatement extends Statement {

    private final Expression condition;
    private final List<Statement> thenBranch;
    private final List<Statement> elseBranch;

    public IfStatement(Expression condition, List<Statement> thenBranch, List<Statement> elseBranch,
                       int line, int column) {
        super(line, column);
        this.condition = condition;
        this.thenBranch = List.copyOf(thenBranch);
        this.elseBranch = List.copyOf(elseBranch);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBranch() {
        return thenBranch;
    }

    /**
     * @return the else statements, empty when the if has no else
     */
    public List<Statement> getElseBranch() {
        return elseBranch;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitIfStatement(this, arg);
    }
}
