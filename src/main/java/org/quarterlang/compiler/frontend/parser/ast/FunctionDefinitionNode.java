package org.quarterlang.compiler.frontend.parser.ast;

import org.quarterlang.compiler.api.SourceInfo;

import java.util.List;

/**
 * A function definition: {@code fn name(p1, p2) { body }}.
 *
 * @param name The function name.
 * @param parameters The parameter names in declaration order.
 * @param body The statements of the body.
 * @param source The position of the definition in the source.
 */
public record FunctionDefinitionNode(
        String name,
        List<String> parameters,
        List<StatementNode> body,
        SourceInfo source
) implements StatementNode {

    public FunctionDefinitionNode {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    public FunctionDefinitionNode(String name, List<String> parameters, List<StatementNode> body) {
        this(name, parameters, body, SourceInfo.UNKNOWN);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
