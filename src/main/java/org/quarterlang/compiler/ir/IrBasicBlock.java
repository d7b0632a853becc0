package org.quarterlang.compiler.ir;

import java.util.List;

/**
 * A named, straight-line sequence of instructions. A block whose last instruction is not
 * a jump falls through to the next block of its function.
 *
 * @param name The block name, unique within its function.
 * @param instructions The instructions in execution order.
 */
public record IrBasicBlock(String name, List<IrInstruction> instructions) {

    public IrBasicBlock {
        instructions = List.copyOf(instructions);
    }
}
