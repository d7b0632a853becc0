package org.quarterlang.compiler.frontend.parser.ast;

/**
 * A reference to a value or parameter by name.
 *
 * @param name The referenced name.
 */
public record VariableNode(String name) implements OperandNode {

    @Override
    public String text() {
        return name;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
