package com.complexity.analyzer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Tree search helpers shared by the analysis passes.
 */
public final class AstWalker {

    private static final StatementVisitor<List<Expression>, Void> DIRECT_EXPRESSIONS = new DirectExpressions();
    private static final StatementVisitor<List<List<Statement>>, Void> NESTED_BLOCKS = new NestedBlocks();
    private static final ExpressionVisitor<List<Expression>, Void> CHILD_EXPRESSIONS = new ChildExpressions();

    private AstWalker() {
    }

    /**
     * Visits every statement in pre-order, descending into loop and branch bodies.
     */
    public static void forEachStatement(List<Statement> statements, Consumer<Statement> action) {
        for (Statement statement : statements) {
            action.accept(statement);
            for (List<Statement> block : nestedBlocks(statement)) {
                forEachStatement(block, action);
            }
        }
    }

    /**
     * Visits an expression and all its sub-expressions in pre-order.
     */
    public static void forEachExpression(Expression expression, Consumer<Expression> action) {
        if (expression == null) {
            return;
        }
        action.accept(expression);
        for (Expression child : expression.accept(CHILD_EXPRESSIONS, null)) {
            forEachExpression(child, action);
        }
    }

    /**
     * @return the expressions a statement holds itself, not those of nested statements
     */
    public static List<Expression> directExpressions(Statement statement) {
        return statement.accept(DIRECT_EXPRESSIONS, null);
    }

    /**
     * @return the statement lists nested directly inside a statement (loop bodies, branches)
     */
    public static List<List<Statement>> nestedBlocks(Statement statement) {
        return statement.accept(NESTED_BLOCKS, null);
    }

    /**
     * Collects the call sites held directly by one statement, including calls inside its expressions.
     */
    public static List<CallSite> callSitesOf(Statement statement) {
        List<CallSite> sites = new ArrayList<>();
        if (statement instanceof CallStatement) {
            CallStatement call = (CallStatement) statement;
            sites.add(new CallSite(call.getName(), call.getArguments(), call.getLine()));
        }
        for (Expression expression : directExpressions(statement)) {
            forEachExpression(expression, e -> {
                if (e instanceof CallExpression) {
                    CallExpression call = (CallExpression) e;
                    sites.add(new CallSite(call.getName(), call.getArguments(), call.getLine()));
                }
            });
        }
        return sites;
    }

    /**
     * Collects every call site in the statements and everything nested in them.
     */
    public static List<CallSite> callSites(List<Statement> statements) {
        List<CallSite> sites = new ArrayList<>();
        forEachStatement(statements, statement -> sites.addAll(callSitesOf(statement)));
        return sites;
    }

    public static int countStatements(List<Statement> statements) {
        int[] count = {0};
        forEachStatement(statements, statement -> count[0]++);
        return count[0];
    }

    public static boolean containsLoop(List<Statement> statements) {
        boolean[] found = {false};
        forEachStatement(statements, statement -> {
            if (isLoop(statement)) {
                found[0] = true;
            }
        });
        return found[0];
    }

    public static boolean isLoop(Statement statement) {
        return statement instanceof ForLoop || statement instanceof WhileLoop
                || statement instanceof RepeatUntilLoop;
    }

    private static final class DirectExpressions implements StatementVisitor<List<Expression>, Void> {

        @Override
        public List<Expression> visitAssignment(Assignment statement, Void arg) {
            return List.of(statement.getTarget(), statement.getValue());
        }

        @Override
        public List<Expression> visitForLoop(ForLoop statement, Void arg) {
            return List.of(statement.getStart(), statement.getStop());
        }

        @Override
        public List<Expression> visitWhileLoop(WhileLoop statement, Void arg) {
            return List.of(statement.getCondition());
        }

        @Override
        public List<Expression> visitRepeatUntilLoop(RepeatUntilLoop statement, Void arg) {
            return List.of(statement.getCondition());
        }

        @Override
        public List<Expression> visitIfStatement(IfStatement statement, Void arg) {
            return List.of(statement.getCondition());
        }

        @Override
        public List<Expression> visitCallStatement(CallStatement statement, Void arg) {
            return statement.getArguments();
        }

        @Override
        public List<Expression> visitReturnStatement(ReturnStatement statement, Void arg) {
            return statement.getValue() == null ? Collections.emptyList() : List.of(statement.getValue());
        }

        @Override
        public List<Expression> visitPrintStatement(PrintStatement statement, Void arg) {
            return List.of(statement.getExpression());
        }

        @Override
        public List<Expression> visitNoOp(NoOp statement, Void arg) {
            return Collections.emptyList();
        }
    }

    private static final class NestedBlocks implements StatementVisitor<List<List<Statement>>, Void> {

        @Override
        public List<List<Statement>> visitAssignment(Assignment statement, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<List<Statement>> visitForLoop(ForLoop statement, Void arg) {
            return List.of(statement.getBody());
        }

        @Override
        public List<List<Statement>> visitWhileLoop(WhileLoop statement, Void arg) {
            return List.of(statement.getBody());
        }

        @Override
        public List<List<Statement>> visitRepeatUntilLoop(RepeatUntilLoop statement, Void arg) {
            return List.of(statement.getBody());
        }

        @Override
        public List<List<Statement>> visitIfStatement(IfStatement statement, Void arg) {
            return List.of(statement.getThenBranch(), statement.getElseBranch());
        }

        @Override
        public List<List<Statement>> visitCallStatement(CallStatement statement, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<List<Statement>> visitReturnStatement(ReturnStatement statement, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<List<Statement>> visitPrintStatement(PrintStatement statement, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<List<Statement>> visitNoOp(NoOp statement, Void arg) {
            return Collections.emptyList();
        }
    }

    private static final class ChildExpressions implements ExpressionVisitor<List<Expression>, Void> {

        @Override
        public List<Expression> visitIdentifier(Identifier expression, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitNumberLiteral(NumberLiteral expression, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitBooleanLiteral(BooleanLiteral expression, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitNullLiteral(NullLiteral expression, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitStringLiteral(StringLiteral expression, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitBinaryOperation(BinaryOperation expression, Void arg) {
            return List.of(expression.getLeft(), expression.getRight());
        }

        @Override
        public List<Expression> visitUnaryOperation(UnaryOperation expression, Void arg) {
            return List.of(expression.getOperand());
        }

        @Override
        public List<Expression> visitArrayAccess(ArrayAccess expression, Void arg) {
            return List.of(expression.getBase(), expression.getIndex());
        }

        @Override
        public List<Expression> visitFieldAccess(FieldAccess expression, Void arg) {
            return List.of(expression.getBase());
        }

        @Override
        public List<Expression> visitLengthCall(LengthCall expression, Void arg) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitRangeExpression(RangeExpression expression, Void arg) {
            return List.of(expression.getStart(), expression.getEnd());
        }

        @Override
        public List<Expression> visitCallExpression(CallExpression expression, Void arg) {
            return expression.getArguments();
        }

        @Override
        public List<Expression> visitArrayCreation(ArrayCreation expression, Void arg) {
            return List.of(expression.getSize());
        }
    }
}
