package com.complexity.analyzer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityMeasureTest {

    @Test
    void rendersGrowthTerms() {
        assertEquals("1", ComplexityMeasure.CONSTANT.toExpression());
        assertEquals("log n", ComplexityMeasure.LOGARITHMIC.toExpression());
        assertEquals("n log n", ComplexityMeasure.LINEARITHMIC.toExpression());
        assertEquals("n^2 (log n)^2", ComplexityMeasure.of(2, 2).toExpression());
        assertEquals("2^n", ComplexityMeasure.exponential(2).toExpression());
        assertEquals("O(n^3)", ComplexityMeasure.polynomial(3).toNotation(CaseComplexity.WORST_SYMBOL));
    }

    @Test
    void dominanceOrdersExponentialThenDegreeThenLog() {
        assertTrue(ComplexityMeasure.exponential(2).dominates(ComplexityMeasure.polynomial(10)));
        assertTrue(ComplexityMeasure.exponential(3).dominates(ComplexityMeasure.exponential(2)));
        assertTrue(ComplexityMeasure.QUADRATIC.dominates(ComplexityMeasure.of(1, 5)));
        assertTrue(ComplexityMeasure.LINEARITHMIC.dominates(ComplexityMeasure.LINEAR));
        assertFalse(ComplexityMeasure.LOGARITHMIC.dominates(ComplexityMeasure.LINEAR));
        assertTrue(ComplexityMeasure.LINEAR.dominates(ComplexityMeasure.LINEAR));
    }

    @Test
    void maxAndMinPickByDominance() {
        assertEquals(ComplexityMeasure.QUADRATIC,
                ComplexityMeasure.LINEARITHMIC.maxWith(ComplexityMeasure.QUADRATIC));
        assertEquals(ComplexityMeasure.LINEARITHMIC,
                ComplexityMeasure.LINEARITHMIC.minWith(ComplexityMeasure.QUADRATIC));
    }

    @Test
    void productAddsExponents() {
        assertEquals(ComplexityMeasure.of(2, 1), ComplexityMeasure.LINEAR.times(ComplexityMeasure.LINEARITHMIC));
        assertEquals(ComplexityMeasure.LINEAR, ComplexityMeasure.CONSTANT.times(ComplexityMeasure.LINEAR));
        assertEquals(new ComplexityMeasure(1, 0, 2), ComplexityMeasure.exponential(2).times(ComplexityMeasure.LINEAR));
    }

    @Test
    void negativeComponentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ComplexityMeasure(-1, 0, 0));
    }
}
