package org.quarterlang.compiler.ir;

/**
 * A named operand. At execution time the name is looked up in the call frames
 * from innermost to outermost; an unbound name that reads as an integer is used as a literal.
 *
 * @param name The variable name.
 */
public record IrVar(String name) implements IrOperand {

    @Override
    public String toString() {
        return name;
    }
}
