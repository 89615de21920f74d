package com.complexity.analyzer.model;

import java.util.List;

/**
 * Closed-form bounds for a recurrence together with the derivation that produced them.
 */
public class RecurrenceSolution {

    public static final String INCONCLUSIVE = "inconclusive";

    private final String theta;
    private final String upper;
    private final String lower;
    private final String method;
    private final String justification;
    private final List<MathStep> mathSteps;
    private final boolean conclusive;

    public RecurrenceSolution(String theta, String upper, String lower, String method, String justification,
                              List<MathStep> mathSteps) {
        this(theta, upper, lower, method, justification, mathSteps, true);
    }

    private RecurrenceSolution(String theta, String upper, String lower, String method, String justification,
                               List<MathStep> mathSteps, boolean conclusive) {
        this.theta = theta;
        this.upper = upper;
        this.lower = lower;
        this.method = method;
        this.justification = justification;
        this.mathSteps = List.copyOf(mathSteps);
        this.conclusive = conclusive;
    }

    /**
     * Sentinel returned when no solving technique applies.
     */
    public static RecurrenceSolution inconclusive(String recurrence, String reason) {
        return new RecurrenceSolution(INCONCLUSIVE, INCONCLUSIVE, INCONCLUSIVE, INCONCLUSIVE, reason,
                List.of(new MathStep("Recurrence", recurrence)), false);
    }

    public String getTheta() {
        return theta;
    }

    public String getUpper() {
        return upper;
    }

    public String getLower() {
        return lower;
    }

    public String getMethod() {
        return method;
    }

    public String getJustification() {
        return justification;
    }

    public List<MathStep> getMathSteps() {
        return mathSteps;
    }

    public boolean isConclusive() {
        return conclusive;
    }
}
