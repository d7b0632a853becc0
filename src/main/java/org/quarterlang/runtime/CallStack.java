package org.quarterlang.runtime;

import org.quarterlang.compiler.ir.IrImm;
import org.quarterlang.compiler.ir.IrOperand;
import org.quarterlang.compiler.ir.IrVar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The stack of active call frames owned by one interpreter. Only the top frame is written to;
 * reads walk the stack from the top frame outward and fall back to reading the name as an integer literal.
 */
public final class CallStack {

    private final Deque<CallFrame> frames = new ArrayDeque<>();

    void push(CallFrame frame) {
        frames.push(frame);
    }

    CallFrame pop() {
        return frames.pop();
    }

    /**
     * @return The frame of the innermost active call.
     * @throws IllegalStateException if no call is active.
     */
    public CallFrame top() {
        CallFrame frame = frames.peek();
        if (frame == null) {
            throw new IllegalStateException("No active call frame.");
        }
        return frame;
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * @return A snapshot of all frames, innermost first.
     */
    public List<CallFrame> frames() {
        return new ArrayList<>(frames);
    }

    /**
     * Writes a value into the top frame.
     */
    public void assign(String name, long value) {
        top().bind(name, value);
    }

    /**
     * Resolves an operand to its current value.
     *
     * @param operand The operand to resolve.
     * @return The value.
     * @throws ExecutionException with {@link RuntimeErrorCode#UNRESOLVED_OPERAND} if a name is neither
     *                            bound in any frame nor an integer literal.
     */
    public long resolve(IrOperand operand) {
        if (operand instanceof IrImm) {
            return ((IrImm) operand).value();
        }
        return resolveName(((IrVar) operand).name());
    }

    /**
     * Resolves a name, innermost frame first.
     */
    public long resolveName(String name) {
        for (CallFrame frame : frames) {
            Long value = frame.lookup(name);
            if (value != null) {
                return value;
            }
        }
        try {
            return Long.parseLong(name);
        } catch (NumberFormatException e) {
            throw new ExecutionException(RuntimeErrorCode.UNRESOLVED_OPERAND,
                    "Cannot resolve '" + name + "': it is not bound in any frame and is not an integer.");
        }
    }
}
