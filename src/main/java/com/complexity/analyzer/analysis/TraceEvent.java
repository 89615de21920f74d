package com.complexity.analyzer.analysis;

/**
 * A single observation made while analysing a program, e.g. how a loop was classified.
 */
public class TraceEvent {

    private final String stage;
    private final String message;
    private final int line;

    public TraceEvent(String stage, String message, int line) {
        this.stage = stage;
        this.message = message;
        this.line = line;
    }

    public String getStage() {
        return stage;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return "[" + stage + "] line " + line + ": " + message;
    }
}
