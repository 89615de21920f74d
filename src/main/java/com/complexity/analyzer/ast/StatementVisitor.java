package com.complexity.analyzer.ast;

/**
 * Visitor over all statement variants.
 * Adding a statement type adds a method here, so every analysis pass has to handle it.
 *
 * @param <R> result type returned up the tree
 * @param <A> argument threaded down the tree
 */
public interface StatementVisitor<R, A> {

    R visitAssignment(Assignment statement, A arg);

    R visitForLoop(ForLoop statement, A arg);

    R visitWhileLoop(WhileLoop statement, A arg);

    R visitRepeatUntilLoop(RepeatUntilLoop statement, A arg);

    R visitIfStatement(IfStatement statement, A arg);

    R visitCallStatement(CallStatement statement, A arg);

    R visitReturnStatement(ReturnStatement statement, A arg);

    R visitPrintStatement(PrintStatement statement, A arg);

    R visitNoOp(NoOp statement, A arg);
}
