package org.quarterlang.compiler.ir;

/**
 * Combines two operands and writes the result into a variable.
 *
 * @param op The operator.
 * @param destination The target variable name.
 * @param left The left operand.
 * @param right The right operand.
 */
public record IrArithmetic(IrArithmeticOp op, String destination, IrOperand left, IrOperand right) implements IrInstruction {

    @Override
    public <T> T accept(IrInstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return op.mnemonic() + " " + destination + ", " + left + ", " + right;
    }
}
