package com.complexity.analyzer.model;

import java.util.Objects;

/**
 * One {@code c·T(n/b)} or {@code c·T(n-k)} term of a recurrence.
 */
public final class RecursiveTerm {

    public enum Reduction {
        DIVIDE, SUBTRACT
    }

    private final int coefficient;
    private final Reduction reduction;
    private final int amount;

    public RecursiveTerm(int coefficient, Reduction reduction, int amount) {
        if (coefficient < 1 || amount < 1) {
            throw new IllegalArgumentException("Coefficient and amount must be positive");
        }
        this.coefficient = coefficient;
        this.reduction = reduction;
        this.amount = amount;
    }

    public static RecursiveTerm divide(int coefficient, int divisor) {
        return new RecursiveTerm(coefficient, Reduction.DIVIDE, divisor);
    }

    public static RecursiveTerm subtract(int coefficient, int decrement) {
        return new RecursiveTerm(coefficient, Reduction.SUBTRACT, decrement);
    }

    public int getCoefficient() {
        return coefficient;
    }

    public Reduction getReduction() {
        return reduction;
    }

    /**
     * @return the divisor for {@link Reduction#DIVIDE}, the decrement for {@link Reduction#SUBTRACT}
     */
    public int getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecursiveTerm)) return false;
        RecursiveTerm that = (RecursiveTerm) o;
        return coefficient == that.coefficient && amount == that.amount && reduction == that.reduction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(coefficient, reduction, amount);
    }

    @Override
    public String toString() {
        String call = reduction == Reduction.DIVIDE ? "T(n/" + amount + ")" : "T(n-" + amount + ")";
        return coefficient == 1 ? call : coefficient + call;
    }
}
