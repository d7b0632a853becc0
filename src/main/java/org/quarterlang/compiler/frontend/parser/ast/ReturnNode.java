package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

/**
 * Ends the current function call.
 *
 * @param value The returned expression, or null for a bare {@code return}.
 * @param source The position of the statement in the source.
 */
public record ReturnNode(
        ExpressionNode value,
        SourceInfo source
) implements StatementNode {

    public ReturnNode(ExpressionNode value) {
        this(value, SourceInfo.UNKNOWN);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
