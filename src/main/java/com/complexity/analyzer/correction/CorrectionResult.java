package com.complexity.analyzer.correction;

public class CorrectionResult {

    private final String correctedCode;
    private final String explanation;
    private final double confidence;

    public CorrectionResult(String correctedCode, String explanation, double confidence) {
        this.correctedCode = correctedCode;
        this.explanation = explanation;
        this.confidence = confidence;
    }

    public String getCorrectedCode() {
        return correctedCode;
    }

    public String getExplanation() {
        return explanation;
    }

    public double getConfidence() {
        return confidence;
    }
}
