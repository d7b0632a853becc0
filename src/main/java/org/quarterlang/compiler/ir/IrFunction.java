package org.quarterlang.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A function of the CFG program.
 *
 * @param name The function name.
 * @param parameters The parameter names in declaration order. They occupy the first slots.
 * @param slots The slot of every name visible at the end of the function. A redeclared name maps to its latest slot.
 * @param slotCount The number of slots allocated; slot indices are never reused.
 * @param blocks The basic blocks in emission order. The first block is the entry block.
 */
public record IrFunction(
        String name,
        List<String> parameters,
        Map<String, Integer> slots,
        int slotCount,
        List<IrBasicBlock> blocks
) {

    public IrFunction {
        parameters = List.copyOf(parameters);
        slots = Collections.unmodifiableMap(new LinkedHashMap<>(slots));
        blocks = List.copyOf(blocks);
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("Function '" + name + "' has no blocks.");
        }
    }

    public IrBasicBlock entryBlock() {
        return blocks.get(0);
    }

    /**
     * @param blockName The block name.
     * @return The index of the block in emission order, or -1 if the function has no such block.
     */
    public int indexOfBlock(String blockName) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).name().equals(blockName)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<IrBasicBlock> block(String blockName) {
        int index = indexOfBlock(blockName);
        return index < 0 ? Optional.empty() : Optional.of(blocks.get(index));
    }
}
