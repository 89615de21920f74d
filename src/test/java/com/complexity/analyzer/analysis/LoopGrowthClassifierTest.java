package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.ForLoop;
import com.complexity.analyzer.ast.RepeatUntilLoop;
import com.complexity.analyzer.ast.Statement;
import com.complexity.analyzer.ast.WhileLoop;
import com.complexity.analyzer.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LoopGrowthClassifierTest {

    private final LoopGrowthClassifier classifier = new LoopGrowthClassifier();

    /** Parses a main block and returns its last statement. */
    private static Statement lastStatement(String body) throws Exception {
        List<Statement> statements = Parser.parse("begin\n" + body + "\nend").getBody();
        return statements.get(statements.size() - 1);
    }

    @Test
    void forLoopOverInputIsLinear() throws Exception {
        ForLoop loop = (ForLoop) lastStatement("for i 🡨 1 to length(A) do s 🡨 s + A[i] end");
        assertEquals(LoopGrowth.LINEAR, classifier.classify(loop));
    }

    @Test
    void forLoopWithLiteralBoundsIsConstant() throws Exception {
        ForLoop loop = (ForLoop) lastStatement("for i 🡨 1 to 100 do s 🡨 s + i end");
        assertEquals(LoopGrowth.CONSTANT, classifier.classify(loop));
    }

    @Test
    void countingToALiteralIsConstant() throws Exception {
        WhileLoop loop = (WhileLoop) lastStatement("""
                k 🡨 0
                while (k < 100) do
                begin
                    k 🡨 k + 1
                end
                """);
        assertEquals(LoopGrowth.CONSTANT, classifier.classify(loop));
    }

    @Test
    void countingToTheInputIsLinear() throws Exception {
        WhileLoop loop = (WhileLoop) lastStatement("""
                while (k < n) do
                begin
                    k 🡨 k + 1
                end
                """);
        assertEquals(LoopGrowth.LINEAR, classifier.classify(loop));
    }

    @Test
    void unboundedConditionIsLinear() throws Exception {
        WhileLoop loop = (WhileLoop) lastStatement("""
                while (node <> null) do
                begin
                    node 🡨 node.next
                end
                """);
        assertEquals(LoopGrowth.LINEAR, classifier.classify(loop));
    }

    @Test
    void geometricStepIsLogarithmic() throws Exception {
        RepeatUntilLoop loop = (RepeatUntilLoop) lastStatement("""
                repeat
                    k 🡨 k * 2
                until k > n
                """);
        assertEquals(LoopGrowth.LOGARITHMIC, classifier.classify(loop));
    }

    @Test
    void earlyExitNeedsBoundFlagAndAssignment() throws Exception {
        WhileLoop withFlag = (WhileLoop) lastStatement("""
                while (i <= n and found = false) do
                begin
                    if (A[i] = x) then
                    begin
                        found 🡨 true
                    end
                    i 🡨 i + 1
                end
                """);
        assertTrue(classifier.hasEarlyExit(withFlag));

        WhileLoop flagNeverSet = (WhileLoop) lastStatement("""
                while (i <= n and found = false) do
                begin
                    i 🡨 i + 1
                end
                """);
        assertFalse(classifier.hasEarlyExit(flagNeverSet));

        WhileLoop plainBound = (WhileLoop) lastStatement("""
                while (i <= n) do
                begin
                    found 🡨 true
                    i 🡨 i + 1
                end
                """);
        assertFalse(classifier.hasEarlyExit(plainBound));
    }

    @Test
    void lengthAndCallsCountAsInput() throws Exception {
        ForLoop loop = (ForLoop) lastStatement("for i 🡨 1 to CALL SIZE(G) do x 🡨 i end");
        assertTrue(classifier.dependsOnInput(loop.getStop(), Set.of()));
        assertFalse(classifier.dependsOnInput(loop.getStart(), Set.of()));
    }
}
