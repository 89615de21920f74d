package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursivePattern;
import com.complexity.analyzer.model.RecursiveTerm;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceSolverTest {

    private final RecurrenceSolver solver = new RecurrenceSolver();

    @Test
    void masterTheoremCaseTwo() {
        RecurrenceSolution solution = solver.solve("T(n) = 2T(n/2) + n");
        assertEquals("Θ(n log n)", solution.getTheta());
        assertEquals("O(n log n)", solution.getUpper());
        assertEquals("Ω(n log n)", solution.getLower());
        assertEquals(MasterTheoremHandler.METHOD, solution.getMethod());
        assertTrue(solution.isConclusive());
    }

    @Test
    void binarySearchRecurrence() {
        assertEquals("Θ(log n)", solver.solve("T(n) = T(n/2) + 1").getTheta());
    }

    @Test
    void masterTheoremCaseTwoWithPolynomialCost() {
        assertEquals("Θ(n^2 log n)", solver.solve("T(n) = 4T(n/2) + n^2").getTheta());
    }

    @Test
    void masterTheoremCaseOne() {
        assertEquals("Θ(n^3)", solver.solve("T(n) = 8T(n/2) + n^2").getTheta());
        assertEquals("Θ(n^2.81)", solver.solve("T(n) = 7T(n/2) + n^2").getTheta());
    }

    @Test
    void masterTheoremCaseThree() {
        RecurrenceSolution solution = solver.solve("T(n) = 2T(n/2) + n^2");
        assertEquals("Θ(n^2)", solution.getTheta());
        assertTrue(solution.getMathSteps().stream().anyMatch(s -> s.toString().contains("Regularity")));
    }

    @Test
    void quicksortHintSplitsTheBounds() {
        Recurrence recurrence = new RecurrenceParser().parse("T(n) = 2T(n/2) + n").orElseThrow();
        RecurrenceSolution solution = solver.solve(recurrence, RecursivePattern.QUICKSORT);
        assertEquals("Θ(n log n)", solution.getTheta());
        assertEquals("O(n^2)", solution.getUpper());
        assertEquals("Ω(n log n)", solution.getLower());
        assertEquals("Master theorem (quicksort partitioning)", solution.getMethod());
    }

    @Test
    void fibonacciUsesTheGoldenRatio() {
        RecurrenceSolution solution = solver.solve("T(n) = T(n-1) + T(n-2) + 1");
        assertEquals("Θ(φ^n)", solution.getTheta());
        assertEquals(CharacteristicEquationHandler.METHOD, solution.getMethod());
    }

    @Test
    void hanoiDoublesEachStep() {
        assertEquals("Θ(2^n)", solver.solve("T(n) = 2T(n-1) + 1").getTheta());
    }

    @Test
    void dominantRootOfFibonacci() {
        double root = CharacteristicEquationHandler.dominantRoot(
                List.of(RecursiveTerm.subtract(1, 1), RecursiveTerm.subtract(1, 2)));
        assertEquals((1 + Math.sqrt(5)) / 2, root, 1e-9);
    }

    @Test
    void substitutionUnrollsSingleDecrement() {
        RecurrenceSolution solution = solver.solve("T(n) = T(n-1) + n");
        assertEquals("Θ(n^2)", solution.getTheta());
        assertEquals(SubstitutionHandler.METHOD, solution.getMethod());
        assertEquals("Θ(n)", solver.solve("T(n) = T(n-1) + 1").getTheta());
    }

    @Test
    void nonRecursiveIsEvaluatedDirectly() {
        RecurrenceSolution solution = solver.solve(Recurrence.nonRecursive(ComplexityMeasure.QUADRATIC));
        assertEquals("Θ(n^2)", solution.getTheta());
        assertEquals(RecurrenceSolver.DIRECT_METHOD, solution.getMethod());
    }

    @Test
    void mixedReductionsAreInconclusive() {
        Recurrence mixed = new Recurrence(List.of(RecursiveTerm.divide(1, 2), RecursiveTerm.subtract(1, 1)),
                ComplexityMeasure.CONSTANT);
        RecurrenceSolution solution = solver.solve(mixed);
        assertFalse(solution.isConclusive());
        assertEquals(RecurrenceSolution.INCONCLUSIVE, solution.getMethod());
    }

    @Test
    void unparsableTextIsInconclusive() {
        assertFalse(solver.solve("not a recurrence").isConclusive());
    }

    @Test
    void failingHandlerIsSkipped() {
        RecurrenceHandler broken = new RecurrenceHandler() {
            @Override
            public String getMethod() {
                return "broken";
            }

            @Override
            public Optional<RecurrenceSolution> solve(Recurrence recurrence, RecursivePattern hint) {
                throw new ArithmeticException("division by zero");
            }
        };
        RecurrenceSolver guarded = new RecurrenceSolver(new RecurrenceParser(),
                List.of(broken, new MasterTheoremHandler()));
        assertEquals("Θ(n log n)", guarded.solve("T(n) = 2T(n/2) + n").getTheta());
    }

    @Test
    void oversizedNumbersNeverEscapeTheSolver() {
        RecurrenceSolution coefficient = assertDoesNotThrow(() -> solver.solve("T(n)=99999999999*T(n/2)+n"));
        assertFalse(coefficient.isConclusive());
        RecurrenceSolution divisor = assertDoesNotThrow(() -> solver.solve("T(n)=T(n/99999999999)+1"));
        assertFalse(divisor.isConclusive());
        RecurrenceSolution logPower = assertDoesNotThrow(() -> solver.solve("T(n)=T(n/2)+(log n)^99999999999"));
        assertFalse(logPower.isConclusive());
    }

    @Test
    void oversizedExponentReadsAsLinear() {
        RecurrenceSolution solution = assertDoesNotThrow(() -> solver.solve("T(n)=T(n/2)+n^99999999999"));
        assertEquals("Θ(n)", solution.getTheta());
    }
}
