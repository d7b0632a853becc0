package org.quarterlang.compiler.ir;

/**
 * Copies the value of an operand into a variable.
 *
 * @param destination The target variable name.
 * @param source The source operand.
 */
public record IrStore(String destination, IrOperand source) implements IrInstruction {

    @Override
    public <T> T accept(IrInstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "store " + destination + ", " + source;
    }
}
