package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecursiveTerm;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceParserTest {

    private final RecurrenceParser parser = new RecurrenceParser();

    @Test
    void parsesDividingRecurrence() {
        Recurrence recurrence = parser.parse("T(n) = 2T(n/2) + n").orElseThrow();
        assertEquals(List.of(RecursiveTerm.divide(2, 2)), recurrence.getTerms());
        assertEquals(ComplexityMeasure.LINEAR, recurrence.getLocalCost());
    }

    @Test
    void acceptsExplicitMultiplicationAndNoSpaces() {
        Recurrence recurrence = parser.parse("T(n)=7*T(n/2)+n^2").orElseThrow();
        assertEquals(7, recurrence.totalCoefficient());
        assertEquals(ComplexityMeasure.QUADRATIC, recurrence.getLocalCost());
    }

    @Test
    void parsesSubtractiveTerms() {
        Recurrence recurrence = parser.parse("T(n) = T(n-1) + T(n-2) + 1").orElseThrow();
        assertEquals(List.of(RecursiveTerm.subtract(1, 1), RecursiveTerm.subtract(1, 2)), recurrence.getTerms());
        assertEquals(ComplexityMeasure.CONSTANT, recurrence.getLocalCost());
    }

    @Test
    void parsesLogarithmicCosts() {
        assertEquals(Optional.of(ComplexityMeasure.LOGARITHMIC), parser.parseCost("log n"));
        assertEquals(Optional.of(ComplexityMeasure.LINEARITHMIC), parser.parseCost("n log n"));
        assertEquals(Optional.of(ComplexityMeasure.of(1, 2)), parser.parseCost("n (log n)^2"));
        assertEquals(Optional.of(ComplexityMeasure.CONSTANT), parser.parseCost("5"));
    }

    @Test
    void malformedExponentFallsBackToLinear() {
        assertEquals(Optional.of(ComplexityMeasure.LINEAR), parser.parseCost("n^k"));
    }

    @Test
    void rejectsUnsupportedShapes() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("S(n) = S(n/2) + 1").isEmpty());
        assertTrue(parser.parse("T(n) = T(n/1) + 1").isEmpty());
        assertTrue(parser.parse("T(n) = T(sqrt n) + 1").isEmpty());
        assertTrue(parser.parseCost("2^n").isEmpty());
    }

    @Test
    void renderingRoundTripsTheSupportedForm() {
        String text = "T(n) = 4T(n/2) + n^2";
        assertEquals(text, parser.parse(text).orElseThrow().toString());
    }
}
