package org.quarterlang.compiler.ir;

/**
 * An immediate integer operand.
 *
 * @param value The integer value.
 */
public record IrImm(long value) implements IrOperand {

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
