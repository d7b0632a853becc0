package org.quarterlang.compiler.frontend.parser.ast;

/**
 * A visitor over all expression kinds.
 *
 * @param <T> The return type of the visit methods.
 */
public interface ExpressionVisitor<T> {
    T visit(LiteralNode node);
    T visit(VariableNode node);
    T visit(BinaryExpressionNode node);
    T visit(CallNode node);
}
