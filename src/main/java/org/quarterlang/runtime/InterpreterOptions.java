package org.quarterlang.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Settings of an {@link Interpreter}.
 *
 * @param mode The execution mode.
 * @param maxCallDepth The maximum number of frames on the call stack.
 */
public record InterpreterOptions(ExecutionMode mode, int maxCallDepth) {

    /**
     * The default maximum depth of the call stack, preventing infinite recursion.
     */
    public static final int DEFAULT_MAX_CALL_DEPTH = 1024;

    private static final String MODE_PATH = "quarterlang.interpreter.execution-mode";
    private static final String DEPTH_PATH = "quarterlang.interpreter.max-call-depth";

    public InterpreterOptions {
        if (mode == null) {
            throw new IllegalArgumentException("Execution mode must not be null.");
        }
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("Maximum call depth must be at least 1, but was " + maxCallDepth + ".");
        }
    }

    public static InterpreterOptions defaults() {
        return new InterpreterOptions(ExecutionMode.GRAPH, DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Reads the {@code quarterlang.interpreter} block of the given configuration.
     *
     * @param config The resolved application configuration.
     * @return The options.
     * @throws ConfigException if a value is missing or invalid.
     */
    public static InterpreterOptions fromConfig(Config config) {
        ExecutionMode mode = config.getEnum(ExecutionMode.class, MODE_PATH);
        int depth = config.getInt(DEPTH_PATH);
        if (depth < 1) {
            throw new ConfigException.BadValue(config.origin(), DEPTH_PATH, "must be at least 1, but was " + depth);
        }
        return new InterpreterOptions(mode, depth);
    }

    public InterpreterOptions withMode(ExecutionMode newMode) {
        return new InterpreterOptions(newMode, maxCallDepth);
    }
}
