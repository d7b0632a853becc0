package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

import java.util.List;

/**
 * A call of a user function or a built-in. Usable as a statement (result discarded)
 * and as the initializer of a value (result stored).
 *
 * @param callee The name of the called function.
 * @param arguments The argument expressions in call order.
 * @param source The position of the call in the source.
 */
public record CallNode(
        String callee,
        List<ExpressionNode> arguments,
        SourceInfo source
) implements StatementNode, ExpressionNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    public CallNode(String callee, List<ExpressionNode> arguments) {
        this(callee, arguments, SourceInfo.UNKNOWN);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
