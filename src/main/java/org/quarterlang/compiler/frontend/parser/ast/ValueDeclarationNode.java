package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

/**
 * Declares a new value: {@code val name : type = initializer}.
 *
 * @param name The declared name.
 * @param declaredType The declared type as written in the source.
 * @param initializer The initializer expression.
 * @param source The position of the declaration in the source.
 */
public record ValueDeclarationNode(
        String name,
        String declaredType,
        ExpressionNode initializer,
        SourceInfo source
) implements StatementNode {

    public ValueDeclarationNode(String name, String declaredType, ExpressionNode initializer) {
        this(name, declaredType, initializer, SourceInfo.UNKNOWN);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
