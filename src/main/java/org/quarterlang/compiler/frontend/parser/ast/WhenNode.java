package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

import java.util.List;

/**
 * A conditional block: {@code when left is right { body }}. The body runs when both operands are equal.
 *
 * @param left The left operand of the comparison.
 * @param right The right operand of the comparison.
 * @param body The statements of the body.
 * @param source The position of the statement in the source.
 */
public record WhenNode(
        OperandNode left,
        OperandNode right,
        List<StatementNode> body,
        SourceInfo source
) implements StatementNode {

    public WhenNode {
        body = List.copyOf(body);
    }

    public WhenNode(OperandNode left, OperandNode right, List<StatementNode> body) {
        this(left, right, body, SourceInfo.UNKNOWN);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
