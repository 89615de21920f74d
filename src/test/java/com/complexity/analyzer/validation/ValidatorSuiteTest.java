package com.complexity.analyzer.validation;

import com.complexity.analyzer.analysis.CallGraph;
import com.complexity.analyzer.analysis.CallGraphBuilder;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorSuiteTest {

    private final ValidatorSuite suite = new ValidatorSuite();

    @Test
    void cleanProgramHasNoWarnings() throws Exception {
        List<String> warnings = suite.validate(Parser.parse("""
                HELPER(x)
                begin
                    y 🡨 x
                end

                begin
                    CALL HELPER(1)
                    m 🡨 CALL max(a, b)
                end
                """));
        assertTrue(warnings.isEmpty(), warnings.toString());
    }

    @Test
    void undefinedCallsAreReported() throws Exception {
        List<String> warnings = suite.validate(Parser.parse("""
                begin
                    CALL REPORT(n)
                    CALL self(n - 1)
                    x 🡨 CALL sqrt(n)
                end
                """));
        assertEquals(List.of("Call to undefined procedure 'report' is costed as constant."), warnings);
    }

    @Test
    void emptyBodiesAreReported() throws Exception {
        List<String> warnings = suite.validate(Parser.parse("""
                NOTHING()
                begin
                end

                begin
                    CALL NOTHING()
                end
                """));
        assertEquals(List.of("Procedure nothing at line 1 has an empty body."), warnings);
    }

    @Test
    void mutualRecursionIsReported() throws Exception {
        List<String> warnings = suite.validate(Parser.parse("""
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

                begin
                    x 🡨 CALL EVEN(n)
                end
                """));
        assertEquals(List.of(
                "Procedure even is mutually recursive; the recurrence only follows direct self-calls.",
                "Procedure odd is mutually recursive; the recurrence only follows direct self-calls."), warnings);
    }

    @Test
    void directRecursionIsNotMutual() throws Exception {
        Program program = Parser.parse("""
                F(n)
                begin
                    CALL F(n - 1)
                end
                """);
        CallGraph callGraph = new CallGraphBuilder().build(program);
        assertTrue(new MutualRecursionValidator().validate(program, callGraph).isEmpty());
    }

    @Test
    void emptyProgramIsReported() throws Exception {
        List<String> warnings = suite.validate(Parser.parse("begin end"));
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).startsWith("Program has no statements"));
    }

    @Test
    void runsOnlyTheGivenValidators() throws Exception {
        ValidatorSuite onlyEmpty = new ValidatorSuite(List.of(new EmptyProgramValidator()));
        assertTrue(onlyEmpty.validate(Parser.parse("begin CALL REPORT(n) end")).isEmpty());
    }
}
