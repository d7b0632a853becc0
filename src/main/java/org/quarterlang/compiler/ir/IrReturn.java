package org.quarterlang.compiler.ir;

/**
 * Ends the current call.
 *
 * @param value The returned operand, or null to return 0.
 */
public record IrReturn(IrOperand value) implements IrInstruction {

    @Override
    public <T> T accept(IrInstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return value == null ? "ret" : "ret " + value;
    }
}
