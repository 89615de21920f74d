package com.complexity.analyzer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CaseComplexityTest {

    private static final CaseComplexity LINEAR = CaseComplexity.uniform(ComplexityMeasure.LINEAR);
    private static final CaseComplexity QUADRATIC = CaseComplexity.uniform(ComplexityMeasure.QUADRATIC);

    @Test
    void sequenceTakesTheLargerOfEachCase() {
        assertEquals(QUADRATIC, LINEAR.combineSequence(QUADRATIC));
        assertEquals(LINEAR, CaseComplexity.constant().combineSequence(LINEAR));
    }

    @Test
    void branchTakesTheCheaperBestCase() {
        CaseComplexity branch = LINEAR.combineBranch(QUADRATIC);
        assertEquals(ComplexityMeasure.LINEAR, branch.getBest());
        assertEquals(ComplexityMeasure.QUADRATIC, branch.getWorst());
        assertEquals(ComplexityMeasure.QUADRATIC, branch.getAverage());
        assertTrue(branch.isOrdered());
    }

    @Test
    void scalingRaisesEveryCase() {
        CaseComplexity scaled = LINEAR.scaleByDegree(1).scaleByLog(1);
        assertEquals(CaseComplexity.uniform(ComplexityMeasure.of(2, 1)), scaled);
    }

    @Test
    void notationUsesOneSymbolPerCase() {
        CaseComplexity cases = QUADRATIC.withBest(ComplexityMeasure.CONSTANT);
        assertEquals("Ω(1)", cases.bestNotation());
        assertEquals("O(n^2)", cases.worstNotation());
        assertEquals("Θ(n^2)", cases.averageNotation());
        assertEquals("Ω(1) / O(n^2) / Θ(n^2)", cases.toString());
    }

    @Test
    void detectsUnorderedCases() {
        CaseComplexity unordered = new CaseComplexity(ComplexityMeasure.QUADRATIC, ComplexityMeasure.LINEAR,
                ComplexityMeasure.LINEAR);
        assertFalse(unordered.isOrdered());
    }
}
