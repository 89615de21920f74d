package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.ArrayAccess;
import com.complexity.analyzer.ast.ArrayCreation;
import com.complexity.analyzer.ast.Assignment;
import com.complexity.analyzer.ast.BinaryOperation;
import com.complexity.analyzer.ast.BooleanLiteral;
import com.complexity.analyzer.ast.CallExpression;
import com.complexity.analyzer.ast.Expression;
import com.complexity.analyzer.ast.ExpressionVisitor;
import com.complexity.analyzer.ast.FieldAccess;
import com.complexity.analyzer.ast.ForLoop;
import com.complexity.analyzer.ast.Identifier;
import com.complexity.analyzer.ast.LengthCall;
import com.complexity.analyzer.ast.NullLiteral;
import com.complexity.analyzer.ast.NumberLiteral;
import com.complexity.analyzer.ast.RangeExpression;
import com.complexity.analyzer.ast.RepeatUntilLoop;
import com.complexity.analyzer.ast.Statement;
import com.complexity.analyzer.ast.StringLiteral;
import com.complexity.analyzer.ast.UnaryOperation;
import com.complexity.analyzer.ast.WhileLoop;

import java.util.List;
import java.util.Set;

/**
 * Decides how many times a loop runs relative to the input size.
 *
 * Stateless; one instance can be shared by every analysis pass.
 */
public class LoopGrowthClassifier {

    private static final InputDependence INPUT_DEPENDENCE = new InputDependence();

    /**
     * A {@code for} loop is linear when its start or stop depends on the input, ignoring
     * only the loop's own iterator.
     */
    public LoopGrowth classify(ForLoop loop) {
        Set<String> ignored = Set.of(loop.getIterator());
        if (dependsOnInput(loop.getStart(), ignored) || dependsOnInput(loop.getStop(), ignored)) {
            return LoopGrowth.LINEAR;
        }
        return LoopGrowth.CONSTANT;
    }

    public LoopGrowth classify(WhileLoop loop) {
        return classifyConditional(loop.getCondition(), loop.getBody());
    }

    public LoopGrowth classify(RepeatUntilLoop loop) {
        return classifyConditional(loop.getCondition(), loop.getBody());
    }

    private LoopGrowth classifyConditional(Expression condition, List<Statement> body) {
        if (IdiomSignatures.isBoundNarrowing(body)) {
            return LoopGrowth.LOGARITHMIC;
        }

        IdiomSignatures.LoopBound bound = IdiomSignatures.findLoopBound(condition);
        if (bound == null) {
            return LoopGrowth.LINEAR;
        }

        String variable = bound.getVariable();
        List<Assignment> assignments = IdiomSignatures.assignmentsIn(body);
        if (assignments.stream().anyMatch(a -> IdiomSignatures.isGeometricStep(a, variable))) {
            return LoopGrowth.LOGARITHMIC;
        }
        if (assignments.stream().anyMatch(a -> IdiomSignatures.isProgression(a, variable))) {
            return dependsOnInput(bound.getLimit(), Set.of(variable)) ? LoopGrowth.LINEAR : LoopGrowth.CONSTANT;
        }
        return LoopGrowth.LINEAR;
    }

    /**
     * A {@code while} exits early when its condition pairs an ordering bound with an equality
     * test on a flag, and the body sets that flag.
     */
    public boolean hasEarlyExit(WhileLoop loop) {
        Expression condition = loop.getCondition();
        if (!IdiomSignatures.isLogicalCombination(condition) || !IdiomSignatures.containsOrderingBound(condition)) {
            return false;
        }
        for (String flag : IdiomSignatures.flagTests(condition)) {
            if (IdiomSignatures.assignsVariable(loop.getBody(), flag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the expression reads anything derived from the input.
     *
     * @param expression the expression to inspect
     * @param ignored identifiers that do not count as input, typically the loop's own iterator
     */
    public boolean dependsOnInput(Expression expression, Set<String> ignored) {
        return expression != null && expression.accept(INPUT_DEPENDENCE, ignored);
    }

    private static final class InputDependence implements ExpressionVisitor<Boolean, Set<String>> {

        @Override
        public Boolean visitIdentifier(Identifier expression, Set<String> ignored) {
            return !ignored.contains(expression.getName());
        }

        @Override
        public Boolean visitNumberLiteral(NumberLiteral expression, Set<String> ignored) {
            return false;
        }

        @Override
        public Boolean visitBooleanLiteral(BooleanLiteral expression, Set<String> ignored) {
            return false;
        }

        @Override
        public Boolean visitNullLiteral(NullLiteral expression, Set<String> ignored) {
            return false;
        }

        @Override
        public Boolean visitStringLiteral(StringLiteral expression, Set<String> ignored) {
            return false;
        }

        @Override
        public Boolean visitBinaryOperation(BinaryOperation expression, Set<String> ignored) {
            return expression.getLeft().accept(this, ignored) || expression.getRight().accept(this, ignored);
        }

        @Override
        public Boolean visitUnaryOperation(UnaryOperation expression, Set<String> ignored) {
            return expression.getOperand().accept(this, ignored);
        }

        @Override
        public Boolean visitArrayAccess(ArrayAccess expression, Set<String> ignored) {
            return expression.getBase().accept(this, ignored) || expression.getIndex().accept(this, ignored);
        }

        @Override
        public Boolean visitFieldAccess(FieldAccess expression, Set<String> ignored) {
            return expression.getBase().accept(this, ignored);
        }

        @Override
        public Boolean visitLengthCall(LengthCall expression, Set<String> ignored) {
            return true;
        }

        @Override
        public Boolean visitRangeExpression(RangeExpression expression, Set<String> ignored) {
            return expression.getStart().accept(this, ignored) || expression.getEnd().accept(this, ignored);
        }

        @Override
        public Boolean visitCallExpression(CallExpression expression, Set<String> ignored) {
            return true;
        }

        @Override
        public Boolean visitArrayCreation(ArrayCreation expression, Set<String> ignored) {
            return expression.getSize().accept(this, ignored);
        }
    }
}
