package com.complexity.analyzer.ast;

import java.util.List;

public class CallStatement extends Statement {

    private final String name;
    private final List<Expression> arguments;

    public CallStatement(String name, List<Expression> arguments, int line, int column) {
        super(line, column);
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitCallStatement(this, arg);
    }
}
