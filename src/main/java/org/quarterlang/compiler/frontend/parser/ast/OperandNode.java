package org.quarterlang.compiler.frontend.parser.ast;

/**
 * An expression that is directly usable as an instruction operand: a literal or a name.
 */
public sealed interface OperandNode extends ExpressionNode permits LiteralNode, VariableNode {

    /**
     * @return The operand as it appears in the source.
     */
    String text();
}
