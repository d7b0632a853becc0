package org.quarterlang.runtime.debug;

/**
 * Thrown by the {@link Debugger} when the operator quits. It unwinds all active calls
 * and ends the debug session; mutations made so far are kept.
 */
public class DebugSessionAbortedException extends RuntimeException {

    public DebugSessionAbortedException(String message) {
        super(message);
    }
}
