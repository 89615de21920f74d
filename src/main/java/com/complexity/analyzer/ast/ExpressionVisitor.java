package com.complexity.analyzer.ast;

/**
 * Visitor over all expression variants.
 *
 * @param <R> result type
 * @param <A> argument threaded down the tree
 */
public interface ExpressionVisitor<R, A> {

    R visitIdentifier(Identifier expression, A arg);

    R visitNumberLiteral(NumberLiteral expression, A arg);

    R visitBooleanLiteral(BooleanLiteral expression, A arg);

    R visitNullLiteral(NullLiteral expression, A arg);

    R visitStringLiteral(StringLiteral expression, A arg);

    R visitBinaryOperation(BinaryOperation expression, A arg);

    R visitUnaryOperation(UnaryOperation expression, A arg);

    R visitArrayAccess(ArrayAccess expression, A arg);

    R visitFieldAccess(FieldAccess expression, A arg);

    R visitLengthCall(LengthCall expression, A arg);

    R visitRangeExpression(RangeExpression expression, A arg);

    R visitCallExpression(CallExpression expression, A arg);

    R visitArrayCreation(ArrayCreation expression, A arg);
}
