package org.quarterlang.runtime;

/**
 * How the interpreter walks the blocks of a function.
 */
public enum ExecutionMode {
    /**
     * Jump-driven execution. {@code Jump} transfers control, {@code ConditionalJump} transfers
     * when its operands are unequal, and a block without a terminal jump falls through to the next block.
     */
    GRAPH,
    /**
     * Straight-line walk over every block and instruction in emission order.
     * Jumps are recorded in the trace log but never taken.
     */
    LINEAR
}
