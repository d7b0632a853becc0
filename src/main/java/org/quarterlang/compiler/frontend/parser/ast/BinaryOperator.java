package org.quarterlang.compiler.frontend.parser.ast;

/**
 * The arithmetic operators of a {@link BinaryExpressionNode}.
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
