package com.complexity.analyzer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An asymptotic growth term {@code base^n · n^degree · (log n)^logPower}.
 *
 * Measures are immutable and ordered by dominance: an exponential factor beats any
 * polynomial, a larger exponential base beats a smaller one, then the larger degree wins
 * and finally the larger log power.
 */
public final class ComplexityMeasure {

    public static final ComplexityMeasure CONSTANT = new ComplexityMeasure(0, 0, 0);
    public static final ComplexityMeasure LOGARITHMIC = new ComplexityMeasure(0, 1, 0);
    public static final ComplexityMeasure LINEAR = new ComplexityMeasure(1, 0, 0);
    public static final ComplexityMeasure LINEARITHMIC = new ComplexityMeasure(1, 1, 0);
    public static final ComplexityMeasure QUADRATIC = new ComplexityMeasure(2, 0, 0);

    private final int degree;
    private final int logPower;
    private final int exponentialBase;

    public ComplexityMeasure(int degree, int logPower, int exponentialBase) {
        if (degree < 0 || logPower < 0 || exponentialBase < 0) {
            throw new IllegalArgumentException("Complexity components must be non-negative: "
                    + degree + ", " + logPower + ", " + exponentialBase);
        }
        this.degree = degree;
        this.logPower = logPower;
        this.exponentialBase = exponentialBase;
    }

    public static ComplexityMeasure of(int degree, int logPower) {
        return new ComplexityMeasure(degree, logPower, 0);
    }

    public static ComplexityMeasure polynomial(int degree) {
        return new ComplexityMeasure(degree, 0, 0);
    }

    public static ComplexityMeasure exponential(int base) {
        return new ComplexityMeasure(0, 0, base);
    }

    public int getDegree() {
        return degree;
    }

    public int getLogPower() {
        return logPower;
    }

    public int getExponentialBase() {
        return exponentialBase;
    }

    public boolean isExponential() {
        return exponentialBase > 0;
    }

    public boolean isConstant() {
        return degree == 0 && logPower == 0 && exponentialBase == 0;
    }

    /**
     * Returns true if this measure grows at least as fast as the other one.
     *
     * @param other the measure to compare with
     * @return whether this measure is greater than or equal to {@code other}
     */
    public boolean dominates(ComplexityMeasure other) {
        if (isExponential() != other.isExponential()) {
            return isExponential();
        }
        if (isExponential() && exponentialBase != other.exponentialBase) {
            return exponentialBase > other.exponentialBase;
        }
        if (degree != other.degree) {
            return degree > other.degree;
        }
        return logPower >= other.logPower;
    }

    public ComplexityMeasure maxWith(ComplexityMeasure other) {
        return dominates(other) ? this : other;
    }

    public ComplexityMeasure minWith(ComplexityMeasure other) {
        return dominates(other) ? other : this;
    }

    public ComplexityMeasure addDegree(int amount) {
        return new ComplexityMeasure(degree + amount, logPower, exponentialBase);
    }

    public ComplexityMeasure addLog(int amount) {
        return new ComplexityMeasure(degree, logPower + amount, exponentialBase);
    }

    /**
     * Product of two growth terms, e.g. a loop of {@code n} iterations around an {@code n log n} call.
     */
    public ComplexityMeasure times(ComplexityMeasure other) {
        int base;
        if (isExponential() && other.isExponential()) {
            base = exponentialBase * other.exponentialBase;
        } else {
            base = Math.max(exponentialBase, other.exponentialBase);
        }
        return new ComplexityMeasure(degree + other.degree, logPower + other.logPower, base);
    }

    /**
     * Renders the bare growth term, e.g. {@code 1}, {@code n^2 log n} or {@code 2^n}.
     */
    public String toExpression() {
        if (isConstant()) {
            return "1";
        }
        List<String> factors = new ArrayList<>();
        if (exponentialBase > 0) {
            factors.add(exponentialBase + "^n");
        }
        if (degree == 1) {
            factors.add("n");
        } else if (degree > 1) {
            factors.add("n^" + degree);
        }
        if (logPower == 1) {
            factors.add("log n");
        } else if (logPower > 1) {
            factors.add("(log n)^" + logPower);
        }
        return String.join(" ", factors);
    }

    /**
     * Renders the measure under an asymptotic symbol, e.g. {@code O(n^2)} or {@code Θ(n log n)}.
     *
     * @param symbol one of Ω, Θ, O
     */
    public String toNotation(String symbol) {
        return symbol + "(" + toExpression() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexityMeasure)) return false;
        ComplexityMeasure that = (ComplexityMeasure) o;
        return degree == that.degree && logPower == that.logPower && exponentialBase == that.exponentialBase;
    }

    @Override
    public int hashCode() {
        return Objects.hash(degree, logPower, exponentialBase);
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
