package com.complexity.analyzer.model;

/**
 * Recognized shapes of recursive procedures and the fixed complexity each one implies.
 */
public enum RecursivePattern {

    FIBONACCI("fibonacci", exp2(), exp2(), exp2(), IdiomMatch.ConfidenceLevel.MEDIUM),
    HANOI("hanoi", exp2(), exp2(), exp2(), IdiomMatch.ConfidenceLevel.HIGH),
    QUICKSORT("quicksort", ComplexityMeasure.LINEARITHMIC, ComplexityMeasure.QUADRATIC,
            ComplexityMeasure.LINEARITHMIC, IdiomMatch.ConfidenceLevel.MEDIUM),
    MERGESORT("mergesort", ComplexityMeasure.LINEARITHMIC, ComplexityMeasure.LINEARITHMIC,
            ComplexityMeasure.LINEARITHMIC, IdiomMatch.ConfidenceLevel.LOW),
    BINARY_SEARCH("binarysearch", ComplexityMeasure.CONSTANT, ComplexityMeasure.LOGARITHMIC,
            ComplexityMeasure.LOGARITHMIC, IdiomMatch.ConfidenceLevel.MEDIUM),
    LINEAR("linear", ComplexityMeasure.LINEAR, ComplexityMeasure.LINEAR,
            ComplexityMeasure.LINEAR, IdiomMatch.ConfidenceLevel.LOW);

    private final String label;
    private final CaseComplexity override;
    private final IdiomMatch.ConfidenceLevel confidence;

    RecursivePattern(String label, ComplexityMeasure best, ComplexityMeasure worst, ComplexityMeasure average,
                     IdiomMatch.ConfidenceLevel confidence) {
        this.label = label;
        this.override = new CaseComplexity(best, worst, average);
        this.confidence = confidence;
    }

    private static ComplexityMeasure exp2() {
        return ComplexityMeasure.exponential(2);
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the complexity the pattern raises the structural result to
     */
    public CaseComplexity getOverride() {
        return override;
    }

    public IdiomMatch.ConfidenceLevel getConfidence() {
        return confidence;
    }
}
