package com.complexity.analyzer.ast;

import java.util.List;

/**
 * A call used as a value, e.g. {@code q 🡨 CALL PARTITION(A, p, r)}.
 */
public class CallExpression extends Expression {

    private final String name;
    private final List<Expression> arguments;

    public CallExpression(String name, List<Expression> arguments, int line, int column) {
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
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitCallExpression(this, arg);
    }
}
