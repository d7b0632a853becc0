package org.quarterlang.compiler.frontend.parser.ast;

/**
 * A text-encoded integer literal.
 *
 * @param text The decimal digits, optionally prefixed with {@code -}.
 */
public record LiteralNode(String text) implements OperandNode {

    public static LiteralNode of(long value) {
        return new LiteralNode(Long.toString(value));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
