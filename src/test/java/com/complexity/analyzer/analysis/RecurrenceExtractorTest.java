package com.complexity.analyzer.analysis;

import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.RecurrenceRelation;
import com.complexity.analyzer.model.RecursiveTerm;
import com.complexity.analyzer.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceExtractorTest {

    private final RecurrenceExtractor extractor = new RecurrenceExtractor();

    private RecurrenceRelation extract(String source) throws Exception {
        return extractor.extract(Parser.parse(source));
    }

    @Test
    void mergesortChargesTheMergeStep() throws Exception {
        RecurrenceRelation relation = extract("""
                MERGESORT(A, p, r)
                begin
                    if (p < r) then
                    begin
                        q 🡨 (p + r) div 2
                        CALL MERGESORT(A, p, q)
                        CALL MERGESORT(A, q + 1, r)
                        CALL MERGE(A, p, q, r)
                    end
                end

                MERGE(A, p, q, r)
                begin
                    for k 🡨 p to r do
                    begin
                        B[k] 🡨 A[k]
                    end
                end
                """);
        assertEquals("mergesort", relation.getIdentifier());
        assertEquals("T(n) = 2T(n/2) + n", relation.getRecurrenceText());
        assertEquals(RecurrenceExtractor.DIVIDE_BASE_CASE, relation.getBaseCase());
        assertEquals(2, relation.getStatistics().getRecursiveCalls());
        assertEquals(2, relation.getStatistics().getDividingCalls());
        assertTrue(relation.getNotes().stream().anyMatch(n -> n.startsWith("Call to merge at line")));
        assertEquals("Analysed unit: mergesort", relation.getNotes().get(0));
    }

    @Test
    void fibonacciGroupsTermsByDecrement() throws Exception {
        RecurrenceRelation relation = extract("""
                FIB(n)
                begin
                    if (n <= 1) then
                    begin
                        return n
                    end
                    return CALL FIB(n - 1) + CALL FIB(n - 2)
                end
                """);
        assertEquals("T(n) = T(n-1) + T(n-2) + 1", relation.getRecurrenceText());
        assertEquals(RecurrenceExtractor.SUBTRACT_BASE_CASE, relation.getBaseCase());
        assertEquals(2, relation.getStatistics().getSubtractingCalls());
    }

    @Test
    void repeatedDecrementBecomesOneCoefficient() throws Exception {
        RecurrenceRelation relation = extract("""
                HANOI(n, a, b, c)
                begin
                    if (n > 0) then
                    begin
                        CALL HANOI(n - 1, a, c, b)
                        CALL HANOI(n - 1, c, b, a)
                    end
                end
                """);
        assertEquals("T(n) = 2T(n-1) + 1", relation.getRecurrenceText());
    }

    @Test
    void selfCallInMainBlock() throws Exception {
        RecurrenceRelation relation = extract("""
                begin
                    if (n <= 1) then
                    begin
                        return 1
                    end
                    return n * CALL self(n - 1)
                end
                """);
        assertEquals(ProgramUnit.DEFAULT_MAIN_NAME, relation.getIdentifier());
        assertEquals("T(n) = T(n/2) + 1", relation.getRecurrenceText());
        assertEquals(RecurrenceExtractor.DIVIDE_BASE_CASE, relation.getBaseCase());
    }

    @Test
    void singleDecrementingCallWithLinearWorkStaysSubtractive() throws Exception {
        RecurrenceRelation relation = extract("""
                SUMALL(A, n)
                begin
                    if (n = 0) then
                    begin
                        return 0
                    end
                    for i 🡨 1 to n do
                    begin
                        s 🡨 s + A[i]
                    end
                    CALL SUMALL(A, n - 1)
                end
                """);
        assertEquals("T(n) = T(n-1) + n", relation.getRecurrenceText());
        assertEquals(RecurrenceExtractor.SUBTRACT_BASE_CASE, relation.getBaseCase());
    }

    @Test
    void iterativeProgramHasNoRecursiveTerm() throws Exception {
        RecurrenceRelation relation = extract("""
                begin
                    for i 🡨 1 to n do
                    begin
                        for j 🡨 1 to n do
                        begin
                            s 🡨 s + A[i, j]
                        end
                    end
                end
                """);
        assertEquals("T(n) = n^2", relation.getRecurrenceText());
        assertEquals(RecurrenceExtractor.NO_BASE_CASE, relation.getBaseCase());
        assertFalse(relation.getRecurrence().isRecursive());
        assertEquals(2, relation.getStatistics().getMaxLoopDepth());
        assertEquals(0, relation.getStatistics().getRecursiveCalls());
    }

    @Test
    void insertionSortShiftLoopCostsNothingExtra() throws Exception {
        RecurrenceRelation relation = extract("""
                begin
                    for i 🡨 2 to n do
                    begin
                        key 🡨 A[i]
                        j 🡨 i - 1
                        while (j > 0 and A[j] > key) do
                        begin
                            A[j + 1] 🡨 A[j]
                            j 🡨 j - 1
                        end
                        A[j + 1] 🡨 key
                    end
                end
                """);
        assertEquals("T(n) = n", relation.getRecurrenceText());
        assertEquals(1, relation.getStatistics().getShiftLoops());
        assertTrue(relation.getNotes().stream().anyMatch(n -> n.startsWith("Array shift loop")));
    }

    @Test
    void logLoopInsideRecursionRaisesLocalCost() throws Exception {
        RecurrenceRelation relation = extract("""
                WALK(n)
                begin
                    if (n <= 1) then
                    begin
                        return 0
                    end
                    k 🡨 1
                    while (k < n) do
                    begin
                        k 🡨 k * 2
                    end
                    CALL WALK(n div 2)
                end
                """);
        assertEquals("T(n) = T(n/2) + log n", relation.getRecurrenceText());
        assertEquals(1, relation.getStatistics().getMaxLogDepth());
    }

    @Test
    void synthesizeHalvesAnySingleCallWithConstantCost() {
        assertEquals(List.of(RecursiveTerm.divide(1, 2)),
                extractor.synthesize(List.of(CallReduction.unknown()), ComplexityMeasure.CONSTANT).getTerms());
        assertEquals(List.of(RecursiveTerm.divide(1, 2)),
                extractor.synthesize(List.of(CallReduction.subtract(1)), ComplexityMeasure.CONSTANT).getTerms());
        assertEquals(List.of(RecursiveTerm.divide(1, 3)),
                extractor.synthesize(List.of(CallReduction.divide(3)), ComplexityMeasure.CONSTANT).getTerms());
        assertEquals(List.of(RecursiveTerm.subtract(1, 2)),
                extractor.synthesize(List.of(CallReduction.subtract(2)), ComplexityMeasure.LINEAR).getTerms());
        assertEquals(List.of(RecursiveTerm.subtract(1, 1)),
                extractor.synthesize(List.of(CallReduction.unknown()), ComplexityMeasure.LINEAR).getTerms());
    }
}
