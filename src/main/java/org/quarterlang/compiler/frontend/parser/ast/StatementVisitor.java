package org.quarterlang.compiler.frontend.parser.ast;

/**
 * A visitor over all statement kinds.
 *
 * @param <T> The return type of the visit methods.
 */
public interface StatementVisitor<T> {
    T visit(ValueDeclarationNode node);
    T visit(AssignmentNode node);
    T visit(FunctionDefinitionNode node);
    T visit(CallNode node);
    T visit(LoopNode node);
    T visit(WhenNode node);
    T visit(ReturnNode node);
}
