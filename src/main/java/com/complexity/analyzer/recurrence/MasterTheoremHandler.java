package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.MathStep;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursivePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Master theorem for {@code T(n) = a·T(n/b) + f(n)} with {@code f(n) = n^d (log n)^k}.
 */
public class MasterTheoremHandler implements RecurrenceHandler {

    private static final Logger logger = LoggerFactory.getLogger(MasterTheoremHandler.class);

    public static final String METHOD = "Master theorem";

    @Override
    public String getMethod() {
        return METHOD;
    }

    @Override
    public Optional<RecurrenceSolution> solve(Recurrence recurrence, RecursivePattern hint) {
        if (!recurrence.isDividing() || recurrence.getLocalCost().isExponential()) {
            return Optional.empty();
        }

        int a = recurrence.totalCoefficient();
        int b = recurrence.divisor();
        ComplexityMeasure f = recurrence.getLocalCost();
        int d = f.getDegree();
        int k = f.getLogPower();
        double c = GrowthFormat.criticalExponent(a, b);

        List<MathStep> steps = new ArrayList<>();
        steps.add(new MathStep("Recurrence", recurrence.toString()));
        steps.add(new MathStep("Coefficients", "a = " + a + ", b = " + b + ", f(n) = " + f.toExpression()));
        steps.add(new MathStep("Critical exponent", "log_" + b + "(" + a + ") = " + GrowthFormat.decimal(c)));

        if (hint == RecursivePattern.QUICKSORT && a == 2 && b == 2 && d == 1 && k == 0) {
            return Optional.of(quicksort(steps));
        }

        String expression;
        String justification;
        if (d < c - GrowthFormat.EPSILON) {
            expression = GrowthFormat.power(c);
            steps.add(new MathStep("Comparison", "d = " + d + " < " + GrowthFormat.decimal(c) + ", case 1"));
            justification = "The leaves dominate: f(n) grows slower than n^log_b(a).";
        } else if (Math.abs(d - c) < GrowthFormat.EPSILON) {
            expression = ComplexityMeasure.of(d, k + 1).toExpression();
            steps.add(new MathStep("Comparison", "d = " + d + " = " + GrowthFormat.decimal(c) + ", case 2"));
            justification = "Every level of the recursion costs the same, adding a log factor.";
        } else {
            double bound = Math.pow(b, d);
            steps.add(new MathStep("Comparison", "d = " + d + " > " + GrowthFormat.decimal(c) + ", case 3"));
            if (a >= bound) {
                logger.debug("Regularity check failed for {}", recurrence);
                return Optional.empty();
            }
            steps.add(new MathStep("Regularity", "a = " + a + " < b^d = " + GrowthFormat.decimal(bound)));
            expression = f.toExpression();
            justification = "The root dominates: f(n) grows faster than n^log_b(a) and is regular.";
        }

        steps.add(new MathStep("Conclusion", GrowthFormat.theta(expression)));
        return Optional.of(new RecurrenceSolution(GrowthFormat.theta(expression), GrowthFormat.upper(expression),
                GrowthFormat.lower(expression), METHOD, justification, steps));
    }

    private RecurrenceSolution quicksort(List<MathStep> steps) {
        String balanced = ComplexityMeasure.LINEARITHMIC.toExpression();
        String skewed = ComplexityMeasure.QUADRATIC.toExpression();
        steps.add(new MathStep("Comparison", "balanced partitions give case 2; "
                + "a partition of sizes 0 and n-1 gives T(n) = T(n-1) + n"));
        steps.add(new MathStep("Conclusion", "best/average " + GrowthFormat.theta(balanced)
                + ", worst " + GrowthFormat.upper(skewed)));
        return new RecurrenceSolution(GrowthFormat.theta(balanced), GrowthFormat.upper(skewed),
                GrowthFormat.lower(balanced), METHOD + " (quicksort partitioning)",
                "Balanced partitions halve the input; a degenerate pivot leaves n-1 elements.", steps);
    }
}
