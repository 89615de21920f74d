package com.complexity.analyzer.model;

import java.util.Objects;

/**
 * Best, worst and average case growth of a piece of code.
 */
public final class CaseComplexity {

    public static final String BEST_SYMBOL = "Ω";
    public static final String WORST_SYMBOL = "O";
    public static final String AVERAGE_SYMBOL = "Θ";

    private final ComplexityMeasure best;
    private final ComplexityMeasure worst;
    private final ComplexityMeasure average;

    public CaseComplexity(ComplexityMeasure best, ComplexityMeasure worst, ComplexityMeasure average) {
        this.best = Objects.requireNonNull(best);
        this.worst = Objects.requireNonNull(worst);
        this.average = Objects.requireNonNull(average);
    }

    public static CaseComplexity constant() {
        return uniform(ComplexityMeasure.CONSTANT);
    }

    public static CaseComplexity uniform(ComplexityMeasure measure) {
        return new CaseComplexity(measure, measure, measure);
    }

    public ComplexityMeasure getBest() {
        return best;
    }

    public ComplexityMeasure getWorst() {
        return worst;
    }

    public ComplexityMeasure getAverage() {
        return average;
    }

    /**
     * Cost of running this code followed by {@code other}.
     */
    public CaseComplexity combineSequence(CaseComplexity other) {
        return new CaseComplexity(best.maxWith(other.best), worst.maxWith(other.worst),
                average.maxWith(other.average));
    }

    /**
     * Cost of running either this code or {@code other}: the best case takes the cheaper branch.
     */
    public CaseComplexity combineBranch(CaseComplexity other) {
        return new CaseComplexity(best.minWith(other.best), worst.maxWith(other.worst),
                average.maxWith(other.average));
    }

    public CaseComplexity maxWith(CaseComplexity other) {
        return combineSequence(other);
    }

    public CaseComplexity scaleByDegree(int amount) {
        return new CaseComplexity(best.addDegree(amount), worst.addDegree(amount), average.addDegree(amount));
    }

    public CaseComplexity scaleByLog(int amount) {
        return new CaseComplexity(best.addLog(amount), worst.addLog(amount), average.addLog(amount));
    }

    public CaseComplexity withBest(ComplexityMeasure newBest) {
        return new CaseComplexity(newBest, worst, average);
    }

    /**
     * @return true when best ≤ average ≤ worst under dominance ordering
     */
    public boolean isOrdered() {
        return average.dominates(best) && worst.dominates(average);
    }

    public String bestNotation() {
        return best.toNotation(BEST_SYMBOL);
    }

    public String worstNotation() {
        return worst.toNotation(WORST_SYMBOL);
    }

    public String averageNotation() {
        return average.toNotation(AVERAGE_SYMBOL);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseComplexity)) return false;
        CaseComplexity that = (CaseComplexity) o;
        return best.equals(that.best) && worst.equals(that.worst) && average.equals(that.average);
    }

    @Override
    public int hashCode() {
        return Objects.hash(best, worst, average);
    }

    @Override
    public String toString() {
        return bestNotation() + " / " + worstNotation() + " / " + averageNotation();
    }
}
