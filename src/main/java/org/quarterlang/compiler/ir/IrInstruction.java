package org.quarterlang.compiler.ir;

/**
 * An instruction in the control-flow-graph IR. The family is closed; consumers dispatch
 * through {@link IrInstructionVisitor}.
 */
public sealed interface IrInstruction
        permits IrAlloc, IrStore, IrArithmetic, IrJump, IrCondJump, IrCall, IrReturn {

    <T> T accept(IrInstructionVisitor<T> visitor);

    /**
     * @return true if the instruction transfers control to another block.
     */
    default boolean isJump() {
        return false;
    }
}
