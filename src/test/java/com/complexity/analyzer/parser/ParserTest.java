package com.complexity.analyzer.parser;

import com.complexity.analyzer.ast.Assignment;
import com.complexity.analyzer.ast.CallExpression;
import com.complexity.analyzer.ast.CallStatement;
import com.complexity.analyzer.ast.ForLoop;
import com.complexity.analyzer.ast.IfStatement;
import com.complexity.analyzer.ast.Procedure;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.ast.RepeatUntilLoop;
import com.complexity.analyzer.ast.ReturnStatement;
import com.complexity.analyzer.ast.WhileLoop;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    @Test
    void headerNamesTheMainBlock() throws Exception {
        Program program = Parser.parse("""
                Algorithm SUM
                begin
                    s 🡨 0
                end
                """);
        assertEquals("sum", program.getName());
        assertEquals(1, program.getBody().size());
        assertInstanceOf(Assignment.class, program.getBody().get(0));
        assertTrue(program.getProcedures().isEmpty());
    }

    @Test
    void parsesNestedForLoops() throws Exception {
        Program program = Parser.parse("""
                begin
                    for i 🡨 1 to n do
                    begin
                        for j 🡨 n downto 1 do
                        begin
                            s 🡨 s + A[i, j]
                        end
                    end
                end
                """);
        ForLoop outer = assertInstanceOf(ForLoop.class, program.getBody().get(0));
        assertEquals("i", outer.getIterator());
        assertFalse(outer.isDescending());

        ForLoop inner = assertInstanceOf(ForLoop.class, outer.getBody().get(0));
        assertEquals("j", inner.getIterator());
        assertTrue(inner.isDescending());
        assertEquals(1, inner.getBody().size());
    }

    @Test
    void elseIfChainsNest() throws Exception {
        Program program = Parser.parse("""
                begin
                    if (x < 0) then
                    begin
                        y 🡨 -1
                    end
                    else if (x = 0) then
                    begin
                        y 🡨 0
                    end
                    else
                    begin
                        y 🡨 1
                    end
                end
                """);
        assertEquals(1, program.getBody().size());
        IfStatement first = assertInstanceOf(IfStatement.class, program.getBody().get(0));
        assertEquals(1, first.getThenBranch().size());
        IfStatement second = assertInstanceOf(IfStatement.class, first.getElseBranch().get(0));
        assertEquals(1, second.getElseBranch().size());
    }

    @Test
    void whileAndRepeatLoops() throws Exception {
        Program program = Parser.parse("""
                begin
                    while (i <= n) do
                    begin
                        i 🡨 i + 1
                    end
                    repeat
                        k 🡨 k * 2
                    until k > n
                end
                """);
        assertInstanceOf(WhileLoop.class, program.getBody().get(0));
        RepeatUntilLoop repeat = assertInstanceOf(RepeatUntilLoop.class, program.getBody().get(1));
        assertEquals(1, repeat.getBody().size());
    }

    @Test
    void proceduresBeforeAndAfterTheMainBlock() throws Exception {
        Program program = Parser.parse("""
                HELPER(A, n)
                begin
                    x 🡨 A[n]
                end

                begin
                    CALL HELPER(A, n)
                    q 🡨 CALL OTHER(A)
                end

                OTHER(A)
                begin
                    return 1
                end
                """);
        assertEquals(2, program.getProcedures().size());
        Procedure helper = program.findProcedure("helper");
        assertNotNull(helper);
        assertEquals(2, helper.getParameters().size());

        CallStatement call = assertInstanceOf(CallStatement.class, program.getBody().get(0));
        assertEquals("helper", call.getName());
        Assignment assignment = assertInstanceOf(Assignment.class, program.getBody().get(1));
        CallExpression other = assertInstanceOf(CallExpression.class, assignment.getValue());
        assertEquals("other", other.getName());

        ReturnStatement ret = assertInstanceOf(ReturnStatement.class,
                program.findProcedure("other").getBody().get(0));
        assertNotNull(ret.getValue());
    }

    @Test
    void algorithmHeaderWithParametersIsAProcedure() throws Exception {
        Program program = Parser.parse("""
                Algorithm FACT(n)
                begin
                    if (n <= 1) then
                    begin
                        return 1
                    end
                    return n * CALL FACT(n - 1)
                end
                """);
        assertNull(program.getName());
        assertEquals(1, program.getProcedures().size());
        assertEquals("fact", program.getProcedures().get(0).getName());
        assertTrue(program.getBody().isEmpty());
    }

    @Test
    void missingBeginIsReported() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> Parser.parse("x 🡨 1"));
        assertEquals(1, e.getLine());
        assertTrue(e.getMessage().endsWith(e.getLine() + ":" + e.getColumn()));
    }

    @Test
    void trailingInputIsRejected() {
        assertThrows(ParserException.class, () -> Parser.parse("begin x 🡨 1 end end"));
    }

    @Test
    void unclosedBlockIsRejected() {
        assertThrows(ParserException.class, () -> Parser.parse("begin\n  for i 🡨 1 to n do\n  begin\n    x 🡨 i\n"));
    }
}
