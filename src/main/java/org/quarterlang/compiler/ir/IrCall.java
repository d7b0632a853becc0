package org.quarterlang.compiler.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Calls a built-in or a user function.
 *
 * @param callee The name of the called function.
 * @param arguments The argument operands in call order.
 * @param resultTarget The variable receiving the result, or null if the result is discarded.
 */
public record IrCall(String callee, List<IrOperand> arguments, String resultTarget) implements IrInstruction {

    public IrCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(IrInstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        String args = arguments.stream().map(IrOperand::toString).collect(Collectors.joining(", "));
        String call = "call " + callee + "(" + args + ")";
        return resultTarget == null ? call : call + " -> " + resultTarget;
    }
}
