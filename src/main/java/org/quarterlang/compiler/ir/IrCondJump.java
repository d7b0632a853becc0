package org.quarterlang.compiler.ir;

/**
 * Transfers control to a block of the same function when the two operands are unequal;
 * otherwise execution continues with the next instruction.
 *
 * @param left The left operand.
 * @param right The right operand.
 * @param target The name of the target block.
 */
public record IrCondJump(IrOperand left, IrOperand right, String target) implements IrInstruction {

    @Override
    public <T> T accept(IrInstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean isJump() {
        return true;
    }

    @Override
    public String toString() {
        return "cjump " + left + ", " + right + ", " + target;
    }
}
