package com.complexity.analyzer.ast;

public class LengthCall extends Expression {

    private final String arrayName;

    public LengthCall(String arrayName, int line, int column) {
        super(line, column);
        this.arrayName = arrayName;
    }

    public String getArrayName() {
        return arrayName;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitLengthCall(this, arg);
    }
}
