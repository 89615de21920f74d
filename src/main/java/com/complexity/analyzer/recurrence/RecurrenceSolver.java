package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.MathStep;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursivePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Solves recurrences by trying each handler in order; the first that applies wins.
 * Never throws: when nothing applies the result is {@link RecurrenceSolution#inconclusive}.
 */
public class RecurrenceSolver {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceSolver.class);

    public static final String DIRECT_METHOD = "Direct evaluation";

    private final RecurrenceParser parser;
    private final List<RecurrenceHandler> handlers;

    public RecurrenceSolver() {
        this(new RecurrenceParser(), List.of(
                new MasterTheoremHandler(),
                new CharacteristicEquationHandler(),
                new SubstitutionHandler()));
    }

    public RecurrenceSolver(RecurrenceParser parser, List<RecurrenceHandler> handlers) {
        this.parser = parser;
        this.handlers = List.copyOf(handlers);
    }

    public RecurrenceSolution solve(String recurrence) {
        Optional<Recurrence> parsed = parser.parse(recurrence);
        if (parsed.isEmpty()) {
            return RecurrenceSolution.inconclusive(String.valueOf(recurrence), "The recurrence could not be parsed.");
        }
        return solve(parsed.get(), null);
    }

    public RecurrenceSolution solve(Recurrence recurrence) {
        return solve(recurrence, null);
    }

    /**
     * @param hint the recursive idiom the recurrence came from, or null
     */
    public RecurrenceSolution solve(Recurrence recurrence, RecursivePattern hint) {
        if (!recurrence.isRecursive()) {
            String expression = recurrence.getLocalCost().toExpression();
            return new RecurrenceSolution(GrowthFormat.theta(expression), GrowthFormat.upper(expression),
                    GrowthFormat.lower(expression), DIRECT_METHOD, "No recursive calls: T(n) = f(n).",
                    List.of(new MathStep("Recurrence", recurrence.toString()),
                            new MathStep("Conclusion", GrowthFormat.theta(expression))));
        }

        for (RecurrenceHandler handler : handlers) {
            try {
                Optional<RecurrenceSolution> solution = handler.solve(recurrence, hint);
                if (solution.isPresent()) {
                    logger.debug("{} solved {} as {}", handler.getMethod(), recurrence, solution.get().getTheta());
                    return solution.get();
                }
            } catch (ArithmeticException | IllegalArgumentException | IllegalStateException e) {
                logger.warn("{} failed on {}: {}", handler.getMethod(), recurrence, e.getMessage(), e);
            }
        }
        return RecurrenceSolution.inconclusive(recurrence.toString(),
                "No solving technique applies to this recurrence.");
    }
}
