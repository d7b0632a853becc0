package org.quarterlang.runtime.builtins;

import java.io.PrintWriter;
import java.util.List;

/**
 * A function implemented by the host rather than by the CFG program.
 */
@FunctionalInterface
public interface BuiltinFunction {

    /**
     * @param arguments The resolved argument values in call order.
     * @param out The program output stream.
     * @return The result of the call.
     * @throws org.quarterlang.runtime.ExecutionException if the arguments are unacceptable.
     */
    long invoke(List<Long> arguments, PrintWriter out);
}
