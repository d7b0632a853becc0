package org.quarterlang.runtime.debug;

import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.console.Console;
import org.quarterlang.runtime.Interpreter;
import org.quarterlang.runtime.InterpreterOptions;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * Runs the entry function of a program under the {@link Debugger}.
 * Program output and debugger interaction share the console's output stream.
 */
public class DebugSession {

    private static final Logger log = LoggerFactory.getLogger(DebugSession.class);

    private final Interpreter interpreter;
    private final Console console;

    /**
     * @param program The program to debug.
     * @param builtins The built-in functions.
     * @param options The interpreter settings.
     * @param console The console for program output and debugger interaction.
     * @param prompt The debugger prompt.
     */
    public DebugSession(IrProgram program, BuiltinRegistry builtins, InterpreterOptions options, Console console, String prompt) {
        this.console = console;
        this.interpreter = new Interpreter(program, builtins, options, console.out());
        this.interpreter.setListener(new Debugger(console, prompt));
    }

    /**
     * Runs the program until it ends or the operator quits.
     *
     * @return The value returned by the entry function, or empty if the session was aborted.
     * @throws org.quarterlang.runtime.ExecutionException if the program fails.
     */
    public OptionalLong run() {
        try {
            long result = interpreter.run();
            console.out().println("Program finished.");
            console.out().flush();
            return OptionalLong.of(result);
        } catch (DebugSessionAbortedException e) {
            log.debug("Debug session aborted at depth {}", interpreter.getCallStack().depth());
            console.out().println(e.getMessage());
            console.out().flush();
            return OptionalLong.empty();
        }
    }

    Interpreter interpreter() {
        return interpreter;
    }
}
