package com.complexity.analyzer.analysis;

import com.complexity.analyzer.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphBuilderTest {

    private static final String PROGRAM = """
            EVEN(n)
            begin
                if (n > 0) then
                begin
                    return CALL ODD(n - 1)
                end
                return true
            end

            ODD(n)
            begin
                if (n > 0) then
                begin
                    return CALL EVEN(n - 1)
                end
                return false
            end

            COUNTDOWN(n)
            begin
                if (n > 0) then
                begin
                    CALL self(n - 1)
                    CALL self(n - 1)
                end
            end

            begin
                CALL EVEN(10)
                CALL REPORT(n)
            end
            """;

    @Test
    void recordsUnitsAndEdges() throws Exception {
        CallGraph graph = new CallGraphBuilder().build(Parser.parse(PROGRAM));

        assertEquals(Set.of("even", "odd", "countdown", "main"), graph.getDefinedUnits());
        assertEquals(Set.of("odd"), graph.getCallees("EVEN"));
        assertEquals(Set.of("even", "report"), graph.getCallees("main"));
        assertEquals(Set.of("report"), graph.getUndefinedCallees());
    }

    @Test
    void selfCallsCountAsDirectRecursion() throws Exception {
        CallGraph graph = new CallGraphBuilder().build(Parser.parse(PROGRAM));

        assertTrue(graph.isRecursive("countdown"));
        assertEquals(Set.of("countdown"), graph.getCallees("countdown"));
        assertFalse(graph.isMutuallyRecursive("countdown"));
    }

    @Test
    void detectsMutualRecursion() throws Exception {
        CallGraph graph = new CallGraphBuilder().build(Parser.parse(PROGRAM));

        assertFalse(graph.isRecursive("even"));
        assertTrue(graph.isMutuallyRecursive("even"));
        assertTrue(graph.isMutuallyRecursive("odd"));
        assertFalse(graph.isMutuallyRecursive("main"));
    }

    @Test
    void statisticsSummarizeTheGraph() throws Exception {
        CallGraph graph = new CallGraphBuilder().build(Parser.parse(PROGRAM));
        assertEquals("CallGraph: 4 units, 5 edges, 6 call sites, 1 recursive", graph.getStatistics());
    }

    @Test
    void emptyMainBlockIsNotAUnit() throws Exception {
        CallGraph graph = new CallGraphBuilder().build(Parser.parse("""
                HELPER(x)
                begin
                    y 🡨 x
                end
                """));
        assertEquals(Set.of("helper"), graph.getDefinedUnits());
        assertFalse(graph.getDefinedUnits().contains("main"));
    }
}
