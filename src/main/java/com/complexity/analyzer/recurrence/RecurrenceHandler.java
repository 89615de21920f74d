package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursivePattern;

import java.util.Optional;

/**
 * One technique for solving a recurrence in closed form.
 */
public interface RecurrenceHandler {

    /**
     * @return the method name reported with a solution
     */
    String getMethod();

    /**
     * Tries to solve the recurrence.
     *
     * @param recurrence the recurrence to solve
     * @param hint the idiom the recurrence was extracted from, or null when unknown
     * @return the solution, or empty when the technique does not apply
     */
    Optional<RecurrenceSolution> solve(Recurrence recurrence, RecursivePattern hint);
}
