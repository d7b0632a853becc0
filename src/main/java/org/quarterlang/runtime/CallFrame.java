package org.quarterlang.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The variable bindings of one active function call, created on entry and discarded on return.
 * Also tracks the instruction the call is currently at, for backtraces.
 */
public final class CallFrame {

    private final String functionName;
    private final Map<String, Long> bindings = new LinkedHashMap<>();
    private String blockName;
    private int instructionIndex;

    /**
     * @param functionName The name of the called function.
     */
    public CallFrame(String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Binds a name to a value, replacing any earlier binding in this frame.
     */
    public void bind(String name, long value) {
        bindings.put(name, value);
    }

    /**
     * @return The value bound to the name in this frame, or null if the frame does not bind it.
     */
    public Long lookup(String name) {
        return bindings.get(name);
    }

    /**
     * @return A read-only view of the bindings in binding order.
     */
    public Map<String, Long> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    void moveTo(String blockName, int instructionIndex) {
        this.blockName = blockName;
        this.instructionIndex = instructionIndex;
    }

    /**
     * @return The block of the instruction being executed, or null before the first instruction.
     */
    public String blockName() {
        return blockName;
    }

    public int instructionIndex() {
        return instructionIndex;
    }

    @Override
    public String toString() {
        if (blockName == null) {
            return functionName;
        }
        return functionName + " at " + blockName + "#" + instructionIndex;
    }
}
