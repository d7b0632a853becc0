package org.quarterlang.compiler.frontend.parser.ast;

/**
 * A flat binary expression. Both sides are operands, never nested expressions.
 *
 * @param left The left operand.
 * @param operator The operator.
 * @param right The right operand.
 */
public record BinaryExpressionNode(
        OperandNode left,
        BinaryOperator operator,
        OperandNode right
) implements ExpressionNode {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
