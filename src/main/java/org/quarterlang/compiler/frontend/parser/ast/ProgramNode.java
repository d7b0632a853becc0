package org.quarterlang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of a program tree: the top-level statements in source order.
 *
 * @param statements The top-level statements, including function definitions.
 */
public record ProgramNode(List<StatementNode> statements) implements AstNode {

    public ProgramNode {
        statements = List.copyOf(statements);
    }
}
