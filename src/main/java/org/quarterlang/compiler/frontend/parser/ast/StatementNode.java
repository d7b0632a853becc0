package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

/**
 * A node that can appear in a statement list: at top level, in a function body or in a block.
 */
public sealed interface StatementNode extends AstNode
        permits ValueDeclarationNode, AssignmentNode, FunctionDefinitionNode, CallNode,
                LoopNode, WhenNode, ReturnNode {

    /**
     * @return The position of the statement in the source, or {@link SourceInfo#UNKNOWN}.
     */
    SourceInfo source();

    <T> T accept(StatementVisitor<T> visitor);
}
