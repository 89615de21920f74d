package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.CaseComplexity;
import com.complexity.analyzer.model.ComplexityMeasure;

import java.util.Locale;

/**
 * Rendering helpers for growth terms whose exponent need not be an integer.
 */
final class GrowthFormat {

    static final double EPSILON = 1e-9;

    private GrowthFormat() {
    }

    static boolean isIntegral(double value) {
        return Math.abs(value - Math.rint(value)) < EPSILON;
    }

    static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * @return {@code log_b(a)}
     */
    static double criticalExponent(int a, int b) {
        return Math.log(a) / Math.log(b);
    }

    /**
     * Renders {@code n^c}, falling back to two decimals when {@code c} is not an integer.
     */
    static String power(double exponent) {
        if (isIntegral(exponent)) {
            return ComplexityMeasure.polynomial((int) Math.rint(exponent)).toExpression();
        }
        return "n^" + decimal(exponent);
    }

    static String theta(String expression) {
        return CaseComplexity.AVERAGE_SYMBOL + "(" + expression + ")";
    }

    static String upper(String expression) {
        return CaseComplexity.WORST_SYMBOL + "(" + expression + ")";
    }

    static String lower(String expression) {
        return CaseComplexity.BEST_SYMBOL + "(" + expression + ")";
    }

    /**
     * Substitutes a subproblem size into a growth term, e.g. {@code n log n} at {@code n/4}.
     */
    static String at(ComplexityMeasure measure, String size) {
        if (measure.isConstant() || size.equals("n")) {
            return measure.toExpression();
        }
        return measure.toExpression().replace("n", "(" + size + ")");
    }
}
