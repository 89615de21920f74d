package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.ComplexityResult;
import com.complexity.analyzer.model.RecursivePattern;
import com.complexity.analyzer.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityAnalyzerTest {

    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();

    private ComplexityResult analyze(String source) throws Exception {
        return analyzer.analyze(Parser.parse(source));
    }

    @Test
    void straightLineCodeIsConstant() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    x 🡨 1
                    y 🡨 x + 2
                    print y
                end
                """);
        assertEquals("Ω(1)", result.getBestCase());
        assertEquals("O(1)", result.getWorstCase());
        assertEquals("Θ(1)", result.getAverageCase());
        assertEquals("No relevant patterns detected.", result.getAnnotations().get(ComplexityAnalyzer.PATTERN_SUMMARY));
        assertNull(result.getIdiom());
    }

    @Test
    void nestedInputLoopsMultiply() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    for i 🡨 1 to n do
                    begin
                        for j 🡨 1 to n do
                        begin
                            for k 🡨 1 to n do
                            begin
                                C[i, j] 🡨 C[i, j] + A[i, k] * B[k, j]
                            end
                        end
                    end
                end
                """);
        assertEquals("O(n^3)", result.getWorstCase());
        assertEquals("Ω(n^3)", result.getBestCase());
        assertEquals("The program contains iterative structures.",
                result.getAnnotations().get(ComplexityAnalyzer.PATTERN_SUMMARY));
        assertEquals("Estimated polynomial degree -> best: 3, worst: 3, average: 3.",
                result.getAnnotations().get(ComplexityAnalyzer.HEURISTIC));
    }

    @Test
    void fixedBoundLoopIsConstant() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    for i 🡨 1 to 10 do
                    begin
                        s 🡨 s + i
                    end
                end
                """);
        assertEquals("O(1)", result.getWorstCase());
    }

    @Test
    void sequentialLoopsTakeTheLargest() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    for i 🡨 1 to n do
                    begin
                        s 🡨 s + A[i]
                    end
                    for i 🡨 1 to n do
                    begin
                        for j 🡨 1 to i do
                        begin
                            s 🡨 s + 1
                        end
                    end
                end
                """);
        assertEquals("O(n^2)", result.getWorstCase());
    }

    @Test
    void doublingLoopIsLogarithmic() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    i 🡨 1
                    while (i < n) do
                    begin
                        i 🡨 i * 2
                    end
                end
                """);
        assertEquals("O(log n)", result.getWorstCase());
    }

    @Test
    void linearLoopAroundHalvingLoop() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    for i 🡨 1 to n do
                    begin
                        j 🡨 n
                        while (j > 1) do
                        begin
                            j 🡨 j div 2
                        end
                    end
                end
                """);
        assertEquals("O(n log n)", result.getWorstCase());
    }

    @Test
    void binarySearchLoopIsLogarithmic() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    low 🡨 1
                    high 🡨 n
                    while (low <= high) do
                    begin
                        mid 🡨 (low + high) div 2
                        if (A[mid] < target) then
                        begin
                            low 🡨 mid + 1
                        end
                        else
                        begin
                            high 🡨 mid - 1
                        end
                    end
                end
                """);
        assertEquals("O(log n)", result.getWorstCase());
    }

    @Test
    void earlyExitFlagLowersOnlyTheBestCase() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    i 🡨 1
                    found 🡨 false
                    while (i <= n and found = false) do
                    begin
                        if (A[i] = x) then
                        begin
                            found 🡨 true
                        end
                        i 🡨 i + 1
                    end
                end
                """);
        assertEquals("Ω(1)", result.getBestCase());
        assertEquals("O(n)", result.getWorstCase());
        assertEquals("Θ(n)", result.getAverageCase());
        assertTrue(result.getAnnotations().get(ComplexityAnalyzer.NOTE).contains("can exit early"));
        assertFalse(result.getAnnotations().containsKey(ComplexityAnalyzer.CASE_ORDER_WARNING));
    }

    @Test
    void branchesKeepBestAtMostWorst() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    if (x > 0) then
                    begin
                        for i 🡨 1 to n do
                        begin
                            s 🡨 s + i
                        end
                    end
                    else
                    begin
                        s 🡨 0
                    end
                end
                """);
        assertEquals(ComplexityMeasure.CONSTANT, result.getMeasures().getBest());
        assertEquals(ComplexityMeasure.LINEAR, result.getMeasures().getWorst());
        assertTrue(result.getMeasures().isOrdered());
    }

    @Test
    void fibonacciIdiomRaisesToExponential() throws Exception {
        ComplexityResult result = analyze("""
                FIB(n)
                begin
                    if (n <= 1) then
                    begin
                        return n
                    end
                    return CALL FIB(n - 1) + CALL FIB(n - 2)
                end
                """);
        assertEquals("O(2^n)", result.getWorstCase());
        assertEquals(RecursivePattern.FIBONACCI, result.getIdiom().getPattern());
        assertEquals("fibonacci", result.getAnnotations().get(ComplexityAnalyzer.MATCHED_IDIOM));
        assertEquals("fib", result.getAnnotations().get(ComplexityAnalyzer.RECURSIVE_PROCEDURE));
        assertTrue(result.getAnnotations().get(ComplexityAnalyzer.HEURISTIC)
                .endsWith("Recursive heuristic applied. Pattern: fibonacci."));
        assertEquals("Recursion detected in fib.", result.getAnnotations().get(ComplexityAnalyzer.PATTERN_SUMMARY));
    }

    @Test
    void quicksortIdiomSeparatesBestAndWorst() throws Exception {
        ComplexityResult result = analyze("""
                QUICKSORT(A, p, r)
                begin
                    if (p < r) then
                    begin
                        q 🡨 CALL PARTITION(A, p, r)
                        CALL QUICKSORT(A, p, q - 1)
                        CALL QUICKSORT(A, q + 1, r)
                    end
                end

                PARTITION(A, p, r)
                begin
                    x 🡨 A[r]
                    i 🡨 p - 1
                    for j 🡨 p to r - 1 do
                    begin
                        if (A[j] <= x) then
                        begin
                            i 🡨 i + 1
                            swap A[i] with A[j]
                        end
                    end
                    return i + 1
                end
                """);
        assertEquals("Ω(n log n)", result.getBestCase());
        assertEquals("O(n^2)", result.getWorstCase());
        assertEquals("Θ(n log n)", result.getAverageCase());
        assertEquals(RecursivePattern.QUICKSORT, result.getIdiom().getPattern());
    }

    @Test
    void analysisIsRepeatable() throws Exception {
        Program program = Parser.parse("""
                begin
                    for i 🡨 1 to n do
                    begin
                        j 🡨 i
                        while (j > 1) do
                        begin
                            j 🡨 j div 2
                        end
                    end
                end
                """);
        ComplexityResult first = analyzer.analyze(program);
        ComplexityResult second = analyzer.analyze(program);
        assertEquals(first.getMeasures(), second.getMeasures());
        assertEquals(first.getAnnotations(), second.getAnnotations());
    }

    @Test
    void listenerReceivesAnalyzerEvents() throws Exception {
        List<TraceEvent> events = new ArrayList<>();
        ComplexityAnalyzer traced = new ComplexityAnalyzer(events::add);
        traced.analyze(Parser.parse("""
                begin
                    for i 🡨 1 to n do
                    begin
                        s 🡨 s + i
                    end
                end
                """));
        assertFalse(events.isEmpty());
        assertEquals(ComplexityAnalyzer.STAGE, events.get(0).getStage());
        assertEquals(2, events.get(0).getLine());
    }

    @Test
    void nestedLoopEventsCarryTheirDepth() throws Exception {
        List<TraceEvent> events = new ArrayList<>();
        new ComplexityAnalyzer(events::add).analyze(Parser.parse("""
                begin
                    for i 🡨 1 to n do
                    begin
                        for j 🡨 1 to n do
                        begin
                            s 🡨 s + 1
                        end
                    end
                end
                """));
        // inner loops finish first
        assertEquals("for j at depth 2 grows LINEAR", events.get(0).getMessage());
        assertEquals("for i at depth 1 grows LINEAR", events.get(1).getMessage());
    }

    @Test
    void triangularLoopIsNoted() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    for i 🡨 1 to n do
                    begin
                        for j 🡨 i to n do
                        begin
                            s 🡨 s + 1
                        end
                    end
                end
                """);
        assertEquals("O(n^2)", result.getWorstCase());
        assertTrue(result.getAnnotations().get(ComplexityAnalyzer.NOTE)
                .contains("Loop at line 4 is bounded by outer iterator i"));
    }

    @Test
    void loopOverInputIsNotNoted() throws Exception {
        ComplexityResult result = analyze("""
                begin
                    for i 🡨 1 to n do
                    begin
                        s 🡨 s + i
                    end
                end
                """);
        assertFalse(result.getAnnotations().get(ComplexityAnalyzer.NOTE).contains("outer iterator"));
    }
}
