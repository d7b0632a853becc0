package org.quarterlang.runtime;

import org.quarterlang.compiler.ir.IrInstruction;

/**
 * The position of an instruction that is about to be executed.
 *
 * @param functionName The function being executed.
 * @param blockName The block holding the instruction.
 * @param instructionIndex The index of the instruction within its block.
 * @param instruction The instruction.
 */
public record ExecutionPoint(String functionName, String blockName, int instructionIndex, IrInstruction instruction) {

    @Override
    public String toString() {
        return "[" + functionName + ":" + blockName + "#" + instructionIndex + "] " + instruction;
    }
}
