package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.MathStep;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursivePattern;
import com.complexity.analyzer.model.RecursiveTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Unrolls {@code T(n) = T(n-k) + f(n)} into a sum of about {@code n/k} copies of {@code f}.
 */
public class SubstitutionHandler implements RecurrenceHandler {

    public static final String METHOD = "Substitution";

    @Override
    public String getMethod() {
        return METHOD;
    }

    @Override
    public Optional<RecurrenceSolution> solve(Recurrence recurrence, RecursivePattern hint) {
        if (recurrence.getTerms().size() != 1 || recurrence.getLocalCost().isExponential()) {
            return Optional.empty();
        }
        RecursiveTerm term = recurrence.getTerms().get(0);
        if (term.getReduction() != RecursiveTerm.Reduction.SUBTRACT || term.getCoefficient() != 1) {
            return Optional.empty();
        }

        ComplexityMeasure f = recurrence.getLocalCost();
        int k = term.getAmount();
        String expression = f.addDegree(1).toExpression();

        List<MathStep> steps = new ArrayList<>();
        steps.add(new MathStep("Recurrence", recurrence.toString()));
        steps.add(new MathStep("Unrolling", "T(n) = T(n-" + k + "i) + Σ_{j<i} f(n-" + k + "j)"));
        steps.add(new MathStep("Depth", "the base case is reached after n/" + k + " steps"));
        steps.add(new MathStep("Sum bound", "(n/" + k + ") · " + f.toExpression() + " = " + expression));
        steps.add(new MathStep("Conclusion", GrowthFormat.theta(expression)));

        return Optional.of(new RecurrenceSolution(GrowthFormat.theta(expression), GrowthFormat.upper(expression),
                GrowthFormat.lower(expression), METHOD,
                "Each of the n/" + k + " levels adds at most f(n) and half of them add at least f(n/2).", steps));
    }
}
