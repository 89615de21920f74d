package com.complexity.analyzer.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A recurrence {@code T(n) = Σ terms + f(n)} in typed form.
 * The string rendering matches what {@code RecurrenceParser} accepts.
 */
public final class Recurrence {

    private final List<RecursiveTerm> terms;
    private final ComplexityMeasure localCost;

    public Recurrence(List<RecursiveTerm> terms, ComplexityMeasure localCost) {
        this.terms = List.copyOf(terms);
        this.localCost = Objects.requireNonNull(localCost);
    }

    public static Recurrence nonRecursive(ComplexityMeasure localCost) {
        return new Recurrence(List.of(), localCost);
    }

    public List<RecursiveTerm> getTerms() {
        return terms;
    }

    public ComplexityMeasure getLocalCost() {
        return localCost;
    }

    public boolean isRecursive() {
        return !terms.isEmpty();
    }

    /**
     * @throws ArithmeticException if the sum does not fit an int
     */
    public int totalCoefficient() {
        return terms.stream().mapToInt(RecursiveTerm::getCoefficient).reduce(0, Math::addExact);
    }

    /**
     * @return true when every term divides n by the same divisor
     */
    public boolean isDividing() {
        return isRecursive()
                && terms.stream().allMatch(t -> t.getReduction() == RecursiveTerm.Reduction.DIVIDE)
                && terms.stream().map(RecursiveTerm::getAmount).distinct().count() == 1;
    }

    public boolean isSubtractive() {
        return isRecursive() && terms.stream().allMatch(t -> t.getReduction() == RecursiveTerm.Reduction.SUBTRACT);
    }

    /**
     * @return the shared divisor of a dividing recurrence
     * @throws IllegalStateException if the recurrence is not dividing
     */
    public int divisor() {
        if (!isDividing()) {
            throw new IllegalStateException("Recurrence does not divide its input: " + this);
        }
        return terms.get(0).getAmount();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Recurrence)) return false;
        Recurrence that = (Recurrence) o;
        return terms.equals(that.terms) && localCost.equals(that.localCost);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms, localCost);
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "T(n) = " + localCost.toExpression();
        }
        String recursive = terms.stream().map(RecursiveTerm::toString).collect(Collectors.joining(" + "));
        return "T(n) = " + recursive + " + " + localCost.toExpression();
    }
}
