package org.quarterlang.compiler.ir;

/**
 * The operator of an {@link IrArithmetic} instruction.
 */
public enum IrArithmeticOp {
    ADD("add"),
    SUBTRACT("sub"),
    MULTIPLY("mul"),
    DIVIDE("div");

    private final String mnemonic;

    IrArithmeticOp(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }

    /**
     * Applies the operator with 64-bit wrap-around semantics.
     *
     * @throws ArithmeticException if a division by zero is attempted.
     */
    public long apply(long left, long right) {
        switch (this) {
            case ADD: return left + right;
            case SUBTRACT: return left - right;
            case MULTIPLY: return left * right;
            case DIVIDE: return left / right;
            default: throw new IllegalStateException("Unknown operator: " + this);
        }
    }
}
