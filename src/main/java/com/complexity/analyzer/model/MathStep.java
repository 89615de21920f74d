package com.complexity.analyzer.model;

/**
 * One labelled line of a solver derivation, e.g. "Critical exponent" / "log_2(2) = 1".
 */
public class MathStep {

    private final String label;
    private final String value;

    public MathStep(String label, String value) {
        this.label = label;
        this.value = value;
    }

    public String getLabel() {
        return label;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return label + ": " + value;
    }
}
