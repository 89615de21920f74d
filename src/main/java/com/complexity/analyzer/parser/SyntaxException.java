package com.complexity.analyzer.parser;

/**
 * Raised when pseudocode source cannot be tokenized or parsed.
 * Carries the position of the offending input.
 */
public class SyntaxException extends Exception {

    private final String detail;
    private final int line;
    private final int column;

    public SyntaxException(String detail, int line, int column) {
        super(detail + " at " + line + ":" + column);
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    /**
     * @return the message without the position suffix
     */
    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
