package com.complexity.analyzer.ast;

public class Identifier extends Expression {

    private final String name;

    public Identifier(String name, int line, int column) {
        super(line, column);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitIdentifier(this, arg);
    }
}
