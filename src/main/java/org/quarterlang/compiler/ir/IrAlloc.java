package org.quarterlang.compiler.ir;

/**
 * Allocates a stack slot for a variable and sets its value to 0.
 *
 * @param name The variable name.
 * @param slot The slot index within the function.
 */
public record IrAlloc(String name, int slot) implements IrInstruction {

    @Override
    public <T> T accept(IrInstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "alloc " + name + " @" + slot;
    }
}
