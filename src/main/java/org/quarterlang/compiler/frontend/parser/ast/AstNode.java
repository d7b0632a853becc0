package org.quarterlang.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes of the program tree.
 * <p>
 * The tree is a closed family: {@link StatementNode} and {@link ExpressionNode} are sealed,
 * and consumers dispatch through {@link StatementVisitor} and {@link ExpressionVisitor},
 * so a new node kind fails to compile until every consumer handles it.
 */
public interface AstNode {
}
