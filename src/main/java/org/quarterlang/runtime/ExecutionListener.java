package org.quarterlang.runtime;

/**
 * Observes the interpreter's instruction dispatch. The interpreter calls the listener
 * on its own thread before every instruction; the instruction runs once the listener returns.
 */
@FunctionalInterface
public interface ExecutionListener {

    /**
     * @param point The instruction about to be executed.
     * @param callStack The current call stack. The top frame belongs to {@code point.functionName()}.
     */
    void beforeInstruction(ExecutionPoint point, CallStack callStack);
}
