package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

import java.util.List;

/**
 * A counted loop: {@code loop [counter in] start to end { body }}.
 *
 * @param counterName The explicit counter name, or null to use the conventional counter.
 * @param start The initial counter value.
 * @param end The counter value at which the loop exits.
 * @param body The statements of the body.
 * @param source The position of the loop in the source.
 */
public record LoopNode(
        String counterName,
        OperandNode start,
        OperandNode end,
        List<StatementNode> body,
        SourceInfo source
) implements StatementNode {

    public LoopNode {
        body = List.copyOf(body);
    }

    public LoopNode(OperandNode start, OperandNode end, List<StatementNode> body) {
        this(null, start, end, body, SourceInfo.UNKNOWN);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
