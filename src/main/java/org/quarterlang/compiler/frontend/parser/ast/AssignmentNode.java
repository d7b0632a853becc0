package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

/**
 * Assigns a new value to an already declared name: {@code name = value}.
 *
 * @param name The target name.
 * @param value The assigned expression.
 * @param source The position of the assignment in the source.
 */
public record AssignmentNode(
        String name,
        ExpressionNode value,
        SourceInfo source
) implements StatementNode {

    public AssignmentNode(String name, ExpressionNode value) {
        this(name, value, SourceInfo.UNKNOWN);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
