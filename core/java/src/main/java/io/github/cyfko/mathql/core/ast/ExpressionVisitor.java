package io.github.cyfko.mathql.core.ast;

/**
 * Double-dispatch visitor over {@link ExpressionNode} trees.
 * <p>
 * The evaluator and the typeset renderer are both implemented as visitors over the same
 * tree, so they always agree on the structure of an expression.
 * </p>
 *
 * @param <R> result type of the visit
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionVisitor<R> {

    R visitNumber(ExpressionNode.NumberLiteral node);

    R visitVariable(ExpressionNode.Variable node);

    R visitConstant(ExpressionNode.Constant node);

    R visitUnary(ExpressionNode.UnaryOp node);

    R visitBinary(ExpressionNode.BinaryOp node);

    R visitCall(ExpressionNode.Call node);
}
