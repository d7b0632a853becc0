package org.quarterlang.compiler.ir;

/**
 * Unconditional transfer of control to a block of the same function.
 *
 * @param target The name of the target block.
 */
public record IrJump(String target) implements IrInstruction {

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
        return "jump " + target;
    }
}
