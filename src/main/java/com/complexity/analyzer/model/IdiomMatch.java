package com.complexity.analyzer.model;

/**
 * Result of recursive-pattern classification: which idiom matched, where, and how sure we are.
 */
public class IdiomMatch {

    /**
     * Confidence level for a matched idiom.
     */
    public enum ConfidenceLevel {
        HIGH, MEDIUM, LOW
    }

    private final RecursivePattern pattern;
    private final String procedureName;
    private final int recursiveCalls;
    private final ConfidenceLevel confidence;

    public IdiomMatch(RecursivePattern pattern, String procedureName, int recursiveCalls) {
        this.pattern = pattern;
        this.procedureName = procedureName;
        this.recursiveCalls = recursiveCalls;
        this.confidence = pattern.getConfidence();
    }

    public RecursivePattern getPattern() {
        return pattern;
    }

    public String getProcedureName() {
        return procedureName;
    }

    public int getRecursiveCalls() {
        return recursiveCalls;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return pattern.getLabel() + " in " + procedureName + " (" + confidence + ")";
    }
}
