package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.Assignment;
import com.complexity.analyzer.ast.AstWalker;
import com.complexity.analyzer.ast.BinaryOperation;
import com.complexity.analyzer.ast.CallSite;
import com.complexity.analyzer.ast.Expression;
import com.complexity.analyzer.ast.Identifier;
import com.complexity.analyzer.ast.IfStatement;
import com.complexity.analyzer.ast.NumberLiteral;
import com.complexity.analyzer.ast.ReturnStatement;
import com.complexity.analyzer.ast.Statement;
import com.complexity.analyzer.ast.WhileLoop;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Syntactic signatures of the algorithm idioms the analysis recognizes.
 *
 * Every heuristic keyword list and shape predicate lives here so the analyzer and the
 * recurrence extractor agree on what, say, a "midpoint" or an "early-exit flag" looks like.
 */
public final class IdiomSignatures {

    /** Name fragments that mark a boolean as an early-exit flag. */
    public static final List<String> EARLY_EXIT_FLAG_MARKERS = List.of("found", "encontr", "flag", "exist");

    /** Name fragments that mark a call as a partition step. */
    public static final List<String> PARTITION_MARKERS = List.of("partici", "partition");

    public static final Set<String> ORDERING_OPERATORS = Set.of("<", "<=", ">", ">=");
    public static final Set<String> BOUND_OPERATORS = Set.of("<", "<=", ">", ">=", "=");
    public static final Set<String> DIVISION_OPERATORS = Set.of("/", "div");

    /** Alias that always refers to the enclosing procedure. */
    public static final String SELF = "self";

    private IdiomSignatures() {
    }

    // ---------------------------------------------------------------- names

    public static boolean isEarlyExitFlag(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return EARLY_EXIT_FLAG_MARKERS.stream().anyMatch(lowered::contains);
    }

    public static boolean isPartitionCall(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return PARTITION_MARKERS.stream().anyMatch(lowered::contains);
    }

    public static boolean isRecursiveCall(CallSite site, String unitName) {
        return site.targets(unitName) || site.targets(SELF);
    }

    public static List<CallSite> recursiveCallSites(ProgramUnit unit) {
        List<CallSite> recursive = new ArrayList<>();
        for (CallSite site : AstWalker.callSites(unit.getBody())) {
            if (isRecursiveCall(site, unit.getName())) {
                recursive.add(site);
            }
        }
        return recursive;
    }

    // ---------------------------------------------------------------- conditions

    public static boolean isLogicalCombination(Expression expression) {
        if (!(expression instanceof BinaryOperation)) {
            return false;
        }
        String operator = ((BinaryOperation) expression).getOperator();
        return operator.equals("and") || operator.equals("or");
    }

    /**
     * Collects the names of early-exit flags tested for equality anywhere in an and/or tree.
     */
    public static Set<String> flagTests(Expression condition) {
        Set<String> flags = new HashSet<>();
        collectFlagTests(condition, flags);
        return flags;
    }

    private static void collectFlagTests(Expression condition, Set<String> flags) {
        if (!(condition instanceof BinaryOperation)) {
            return;
        }
        BinaryOperation operation = (BinaryOperation) condition;
        if (isLogicalCombination(operation)) {
            collectFlagTests(operation.getLeft(), flags);
            collectFlagTests(operation.getRight(), flags);
        } else if (operation.getOperator().equals("=")) {
            addIfFlag(operation.getLeft(), flags);
            addIfFlag(operation.getRight(), flags);
        }
    }

    private static void addIfFlag(Expression side, Set<String> flags) {
        if (side instanceof Identifier && isEarlyExitFlag(((Identifier) side).getName())) {
            flags.add(((Identifier) side).getName());
        }
    }

    public static boolean containsOrderingBound(Expression condition) {
        boolean[] found = {false};
        AstWalker.forEachExpression(condition, e -> {
            if (e instanceof BinaryOperation && ORDERING_OPERATORS.contains(((BinaryOperation) e).getOperator())) {
                found[0] = true;
            }
        });
        return found[0];
    }

    /**
     * Finds the comparison that bounds a loop: the first {@code < <= > >= =} test (searching
     * and/or trees left first) with a bare identifier operand that is not an early-exit flag.
     *
     * @return the bound, or null if the condition has none
     */
    public static LoopBound findLoopBound(Expression condition) {
        if (!(condition instanceof BinaryOperation)) {
            return null;
        }
        BinaryOperation operation = (BinaryOperation) condition;
        if (isLogicalCombination(operation)) {
            LoopBound left = findLoopBound(operation.getLeft());
            return left != null ? left : findLoopBound(operation.getRight());
        }
        if (!BOUND_OPERATORS.contains(operation.getOperator())) {
            return null;
        }
        if (isBoundVariable(operation.getLeft())) {
            return new LoopBound(((Identifier) operation.getLeft()).getName(), operation.getRight());
        }
        if (isBoundVariable(operation.getRight())) {
            return new LoopBound(((Identifier) operation.getRight()).getName(), operation.getLeft());
        }
        return null;
    }

    private static boolean isBoundVariable(Expression expression) {
        return expression instanceof Identifier && !isEarlyExitFlag(((Identifier) expression).getName());
    }

    /**
     * A loop-controlling variable and the expression it is compared against.
     */
    public static final class LoopBound {
        private final String variable;
        private final Expression limit;

        LoopBound(String variable, Expression limit) {
            this.variable = variable;
            this.limit = limit;
        }

        public String getVariable() {
            return variable;
        }

        public Expression getLimit() {
            return limit;
        }
    }

    // ---------------------------------------------------------------- arithmetic shapes

    /**
     * @return the literal value, or null if the expression is not a number literal
     */
    public static Long literalValue(Expression expression) {
        return expression instanceof NumberLiteral ? ((NumberLiteral) expression).getValue() : null;
    }

    public static boolean isIdentifier(Expression expression, String name) {
        return expression instanceof Identifier && ((Identifier) expression).getName().equals(name);
    }

    /**
     * Matches {@code (a + b) / 2}, {@code (a + b) div 2} and {@code a + (b - a) div 2}.
     */
    public static boolean isMidpoint(Expression expression) {
        return !midpointOperands(expression).isEmpty();
    }

    /**
     * @return the identifiers a midpoint averages, empty if the expression is no midpoint
     */
    public static Set<String> midpointOperands(Expression expression) {
        Set<String> operands = new HashSet<>();
        if (!(expression instanceof BinaryOperation)) {
            return operands;
        }
        BinaryOperation operation = (BinaryOperation) expression;

        if (isHalvingBy(operation, 2) && operation.getLeft() instanceof BinaryOperation
                && ((BinaryOperation) operation.getLeft()).getOperator().equals("+")) {
            BinaryOperation sum = (BinaryOperation) operation.getLeft();
            addIdentifier(sum.getLeft(), operands);
            addIdentifier(sum.getRight(), operands);
            if (operands.isEmpty()) {
                operands.add("");
            }
            return operands;
        }

        // lo + (hi - lo) div 2
        if (operation.getOperator().equals("+") && operation.getRight() instanceof BinaryOperation) {
            BinaryOperation half = (BinaryOperation) operation.getRight();
            if (isHalvingBy(half, 2) && half.getLeft() instanceof BinaryOperation
                    && ((BinaryOperation) half.getLeft()).getOperator().equals("-")) {
                addIdentifier(operation.getLeft(), operands);
                addIdentifier(((BinaryOperation) half.getLeft()).getLeft(), operands);
                if (operands.isEmpty()) {
                    operands.add("");
                }
            }
        }
        return operands;
    }

    private static void addIdentifier(Expression expression, Set<String> names) {
        if (expression instanceof Identifier) {
            names.add(((Identifier) expression).getName());
        }
    }

    private static boolean isHalvingBy(BinaryOperation operation, long divisor) {
        Long value = literalValue(operation.getRight());
        return DIVISION_OPERATORS.contains(operation.getOperator()) && value != null && value == divisor;
    }

    /**
     * @return the divisor of {@code x / c} or {@code x div c} with {@code c >= 2}, otherwise 0
     */
    public static int halvingDivisor(Expression expression) {
        if (!(expression instanceof BinaryOperation)) {
            return 0;
        }
        BinaryOperation operation = (BinaryOperation) expression;
        Long value = literalValue(operation.getRight());
        if (DIVISION_OPERATORS.contains(operation.getOperator()) && value != null && value >= 2) {
            return (int) Math.min(value, Integer.MAX_VALUE);
        }
        return 0;
    }

    /**
     * @return the decrement of {@code ident - c} with {@code c >= 1}, otherwise 0
     */
    public static int subtractedLiteral(Expression expression) {
        if (!(expression instanceof BinaryOperation)) {
            return 0;
        }
        BinaryOperation operation = (BinaryOperation) expression;
        Long value = literalValue(operation.getRight());
        if (operation.getOperator().equals("-") && operation.getLeft() instanceof Identifier
                && value != null && value >= 1) {
            return (int) Math.min(value, Integer.MAX_VALUE);
        }
        return 0;
    }

    /**
     * Matches {@code v 🡨 v ± c} and {@code v 🡨 c + v}.
     */
    public static boolean isProgression(Assignment assignment, String variable) {
        if (!isIdentifier(assignment.getTarget(), variable) || !(assignment.getValue() instanceof BinaryOperation)) {
            return false;
        }
        BinaryOperation value = (BinaryOperation) assignment.getValue();
        if (value.getOperator().equals("+")) {
            return (isIdentifier(value.getLeft(), variable) && literalValue(value.getRight()) != null)
                    || (isIdentifier(value.getRight(), variable) && literalValue(value.getLeft()) != null);
        }
        return value.getOperator().equals("-")
                && isIdentifier(value.getLeft(), variable) && literalValue(value.getRight()) != null;
    }

    /**
     * Matches {@code v 🡨 v / c}, {@code v 🡨 v div c} and {@code v 🡨 v * c} for literals {@code c > 1}.
     */
    public static boolean isGeometricStep(Assignment assignment, String variable) {
        if (!isIdentifier(assignment.getTarget(), variable) || !(assignment.getValue() instanceof BinaryOperation)) {
            return false;
        }
        BinaryOperation value = (BinaryOperation) assignment.getValue();
        if (DIVISION_OPERATORS.contains(value.getOperator())) {
            Long divisor = literalValue(value.getRight());
            return isIdentifier(value.getLeft(), variable) && divisor != null && divisor > 1;
        }
        if (value.getOperator().equals("*")) {
            Long left = literalValue(value.getLeft());
            Long right = literalValue(value.getRight());
            return (isIdentifier(value.getLeft(), variable) && right != null && right > 1)
                    || (isIdentifier(value.getRight(), variable) && left != null && left > 1);
        }
        return false;
    }

    // ---------------------------------------------------------------- statement shapes

    public static List<Assignment> assignmentsIn(List<Statement> statements) {
        List<Assignment> assignments = new ArrayList<>();
        AstWalker.forEachStatement(statements, statement -> {
            if (statement instanceof Assignment) {
                assignments.add((Assignment) statement);
            }
        });
        return assignments;
    }

    public static boolean assignsVariable(List<Statement> statements, String variable) {
        return assignmentsIn(statements).stream().anyMatch(a -> isIdentifier(a.getTarget(), variable));
    }

    /**
     * Bound narrowing: {@code mid 🡨 (lo + hi) div 2} followed by {@code lo} or {@code hi}
     * being reassigned from {@code mid}.
     */
    public static boolean isBoundNarrowing(List<Statement> body) {
        List<Assignment> assignments = assignmentsIn(body);
        for (Assignment midpoint : assignments) {
            Set<String> bounds = midpointOperands(midpoint.getValue());
            if (bounds.isEmpty() || !(midpoint.getTarget() instanceof Identifier)) {
                continue;
            }
            String mid = ((Identifier) midpoint.getTarget()).getName();
            for (Assignment narrowing : assignments) {
                if (narrowing.getTarget() instanceof Identifier
                        && bounds.contains(((Identifier) narrowing.getTarget()).getName())
                        && derivesFrom(narrowing.getValue(), mid)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean derivesFrom(Expression value, String variable) {
        if (isIdentifier(value, variable)) {
            return true;
        }
        if (value instanceof BinaryOperation) {
            BinaryOperation operation = (BinaryOperation) value;
            return (operation.getOperator().equals("+") || operation.getOperator().equals("-"))
                    && isIdentifier(operation.getLeft(), variable)
                    && literalValue(operation.getRight()) != null;
        }
        return false;
    }

    /**
     * An early {@code return} in the then-branch of a top-level {@code if}.
     */
    public static boolean hasEarlyReturn(List<Statement> body) {
        for (Statement statement : body) {
            if (statement instanceof IfStatement) {
                for (Statement inner : ((IfStatement) statement).getThenBranch()) {
                    if (inner instanceof ReturnStatement) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * A midpoint assignment at the top level of a body or inside any nesting of {@code if}s.
     */
    public static boolean hasMidpointAssignment(List<Statement> body) {
        for (Statement statement : body) {
            if (statement instanceof Assignment && isMidpoint(((Assignment) statement).getValue())) {
                return true;
            }
            if (statement instanceof IfStatement) {
                IfStatement branch = (IfStatement) statement;
                if (hasMidpointAssignment(branch.getThenBranch()) || hasMidpointAssignment(branch.getElseBranch())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * A {@code while} whose condition compares values, or a call to a partition routine.
     */
    public static boolean hasPartitionIdiom(List<Statement> body) {
        boolean[] found = {false};
        AstWalker.forEachStatement(body, statement -> {
            if (statement instanceof WhileLoop && containsComparison(((WhileLoop) statement).getCondition())) {
                found[0] = true;
            }
            for (CallSite site : AstWalker.callSitesOf(statement)) {
                if (isPartitionCall(site.getName())) {
                    found[0] = true;
                }
            }
        });
        return found[0];
    }

    private static boolean containsComparison(Expression condition) {
        boolean[] found = {false};
        AstWalker.forEachExpression(condition, e -> {
            if (e instanceof BinaryOperation && BOUND_OPERATORS.contains(((BinaryOperation) e).getOperator())) {
                found[0] = true;
            }
        });
        return found[0];
    }

    // ---------------------------------------------------------------- recursive call shapes

    /**
     * Variables assigned a halving or a midpoint somewhere in the body, with their divisor.
     */
    public static Map<String, Integer> halvingVariables(List<Statement> body) {
        Map<String, Integer> variables = new HashMap<>();
        for (Assignment assignment : assignmentsIn(body)) {
            if (!(assignment.getTarget() instanceof Identifier)) {
                continue;
            }
            String name = ((Identifier) assignment.getTarget()).getName();
            if (isMidpoint(assignment.getValue())) {
                variables.putIfAbsent(name, 2);
            } else {
                int divisor = halvingDivisor(assignment.getValue());
                if (divisor > 0) {
                    variables.putIfAbsent(name, divisor);
                }
            }
        }
        return variables;
    }

    /**
     * Classifies how a recursive call shrinks its input. Halving shapes, including uses of a
     * variable holding a midpoint such as {@code mid - 1}, are checked before decrements.
     */
    public static CallReduction reductionOf(CallSite site, Map<String, Integer> halvingVariables) {
        for (Expression argument : site.getArguments()) {
            int divisor = divisorIn(argument, halvingVariables);
            if (divisor > 0) {
                return CallReduction.divide(divisor);
            }
        }
        for (Expression argument : site.getArguments()) {
            int decrement = subtractedLiteral(argument);
            if (decrement > 0) {
                return CallReduction.subtract(decrement);
            }
        }
        return CallReduction.unknown();
    }

    private static int divisorIn(Expression argument, Map<String, Integer> halvingVariables) {
        int[] divisor = {0};
        AstWalker.forEachExpression(argument, e -> {
            if (divisor[0] > 0) {
                return;
            }
            if (isMidpoint(e)) {
                divisor[0] = 2;
            } else if (halvingDivisor(e) > 0) {
                divisor[0] = halvingDivisor(e);
            } else if (e instanceof Identifier && halvingVariables.containsKey(((Identifier) e).getName())) {
                divisor[0] = halvingVariables.get(((Identifier) e).getName());
            }
        });
        return divisor[0];
    }
}
