package org.quarterlang.compiler.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface ExpressionNode extends AstNode
        permits OperandNode, BinaryExpressionNode, CallNode {

    <T> T accept(ExpressionVisitor<T> visitor);
}
