package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.MathStep;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursivePattern;
import com.complexity.analyzer.model.RecursiveTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Linear recurrences {@code T(n) = Σ cᵢ·T(n-dᵢ) + f(n)} with at least two recursive calls.
 *
 * The homogeneous part grows like {@code r^n} for the dominant root {@code r} of
 * {@code Σ cᵢ r^-dᵢ = 1}; a polynomial {@code f} does not change that.
 */
public class CharacteristicEquationHandler implements RecurrenceHandler {

    public static final String METHOD = "Characteristic equation";

    private static final int ITERATIONS = 200;

    @Override
    public String getMethod() {
        return METHOD;
    }

    @Override
    public Optional<RecurrenceSolution> solve(Recurrence recurrence, RecursivePattern hint) {
        if (!recurrence.isSubtractive() || recurrence.totalCoefficient() < 2
                || recurrence.getLocalCost().isExponential()) {
            return Optional.empty();
        }

        List<RecursiveTerm> terms = recurrence.getTerms();
        List<MathStep> steps = new ArrayList<>();
        steps.add(new MathStep("Recurrence", recurrence.toString()));
        steps.add(new MathStep("Homogeneous part", "T(n) = " + terms.stream()
                .map(RecursiveTerm::toString).collect(Collectors.joining(" + "))));
        steps.add(new MathStep("Characteristic equation", equation(terms)));

        double root = dominantRoot(terms);
        steps.add(new MathStep("Dominant root", "r ≈ " + String.format(Locale.ROOT, "%.3f", root)));

        String expression = label(terms, root);
        steps.add(new MathStep("Conclusion", GrowthFormat.theta(expression)));
        return Optional.of(new RecurrenceSolution(GrowthFormat.theta(expression), GrowthFormat.upper(expression),
                GrowthFormat.lower(expression), METHOD,
                "The solution grows like the largest root of the characteristic polynomial.", steps));
    }

    private static String label(List<RecursiveTerm> terms, double root) {
        if (terms.size() == 2 && isUnitTerm(terms.get(0), 1) && isUnitTerm(terms.get(1), 2)) {
            return "φ^n";
        }
        if (terms.size() == 1 && terms.get(0).getAmount() == 1) {
            return terms.get(0).getCoefficient() + "^n";
        }
        if (GrowthFormat.isIntegral(root)) {
            return Math.round(root) + "^n";
        }
        return String.format(Locale.ROOT, "%.3f^n", root);
    }

    private static boolean isUnitTerm(RecursiveTerm term, int decrement) {
        return term.getCoefficient() == 1 && term.getAmount() == decrement;
    }

    /**
     * Bisection on {@code g(r) = Σ cᵢ r^-dᵢ}, which is decreasing for {@code r > 0}.
     * {@code g(1) = Σ cᵢ ≥ 2} and {@code g(Σ cᵢ + 1) < 1}, so the root lies between.
     */
    static double dominantRoot(List<RecursiveTerm> terms) {
        double low = 1.0;
        double high = terms.stream().mapToInt(RecursiveTerm::getCoefficient).sum() + 1.0;
        for (int i = 0; i < ITERATIONS; i++) {
            double middle = (low + high) / 2;
            if (weight(terms, middle) > 1.0) {
                low = middle;
            } else {
                high = middle;
            }
        }
        return (low + high) / 2;
    }

    private static double weight(List<RecursiveTerm> terms, double r) {
        double sum = 0;
        for (RecursiveTerm term : terms) {
            sum += term.getCoefficient() * Math.pow(r, -term.getAmount());
        }
        return sum;
    }

    private static String equation(List<RecursiveTerm> terms) {
        int order = terms.stream().mapToInt(RecursiveTerm::getAmount).max().orElse(1);
        List<String> right = new ArrayList<>();
        for (RecursiveTerm term : terms) {
            int power = order - term.getAmount();
            String coefficient = term.getCoefficient() == 1 ? "" : String.valueOf(term.getCoefficient());
            if (power == 0) {
                right.add(coefficient.isEmpty() ? "1" : coefficient);
            } else if (power == 1) {
                right.add(coefficient + "r");
            } else {
                right.add(coefficient + "r^" + power);
            }
        }
        String left = order == 1 ? "r" : "r^" + order;
        return left + " = " + String.join(" + ", right);
    }
}
