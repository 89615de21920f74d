package com.complexity.analyzer.ast;

import java.util.List;

/**
 * {@code for i 🡨 start to|downto stop do ...}
 */
public class ForLoop extends Statement {

    private final String iterator;
    private final Expression start;
    private final Expression stop;
    private final boolean descending;
    private final List<Statement> body;

    public ForLoop(String iterator, Expression start, Expression stop, boolean descending,
                   List<Statement> body, int line, int column) {
        super(line, column);
        this.iterator = iterator;
        this.start = start;
        this.stop = stop;
        this.descending = descending;
        this.body = List.copyOf(body);
    }

    public String getIterator() {
        return iterator;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getStop() {
        return stop;
    }

    public boolean isDescending() {
        return descending;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visitForLoop(this, arg);
    }
}
