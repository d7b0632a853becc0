package org.quarterlang.repl;

import org.quarterlang.compiler.Compiler;
import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.console.Console;
import org.quarterlang.runtime.ExecutionException;
import org.quarterlang.runtime.Interpreter;
import org.quarterlang.runtime.InterpreterOptions;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * The line-at-a-time driver loop.
 * <p>
 * Every input line is compiled as a complete program and run on a fresh interpreter.
 * Nothing survives from one line to the next: a line cannot use a value or a function
 * defined on an earlier line. A failing line is reported and the loop goes on.
 */
public class ReplSession {

    /**
     * The program name used in diagnostics for REPL input.
     */
    public static final String PROGRAM_NAME = "<repl>";

    private static final Logger log = LoggerFactory.getLogger(ReplSession.class);

    private final BuiltinRegistry builtins;
    private final InterpreterOptions options;
    private final String prompt;

    /**
     * @param builtins The built-in functions available to every line.
     * @param options The interpreter settings used for every line.
     * @param prompt The input prompt.
     */
    public ReplSession(BuiltinRegistry builtins, InterpreterOptions options, String prompt) {
        this.builtins = builtins;
        this.options = options;
        this.prompt = prompt;
    }

    /**
     * Reads and evaluates lines until the input ends or the user types {@code exit} or {@code quit}.
     *
     * @param console The console to read from and write to.
     * @return The number of lines that failed.
     */
    public int run(Console console) {
        int failures = 0;
        while (true) {
            String line = console.readLine(prompt);
            if (line == null) {
                break;
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String command = trimmed.toLowerCase(Locale.ROOT);
            if (command.equals("exit") || command.equals("quit")) {
                break;
            }
            if (!evaluate(line, console)) {
                failures++;
            }
        }
        log.debug("REPL session ended with {} failed line(s)", failures);
        return failures;
    }

    /**
     * Compiles and runs one line as a self-contained program.
     *
     * @param line The source line.
     * @param console The console receiving program output and error reports.
     * @return true if the line compiled and ran without error.
     */
    public boolean evaluate(String line, Console console) {
        try {
            IrProgram program = new Compiler().compile(List.of(line), PROGRAM_NAME);
            new Interpreter(program, builtins, options, console.out()).run();
            console.out().flush();
            return true;
        } catch (CompilationException | ExecutionException e) {
            log.debug("REPL line failed: {}", line, e);
            console.out().flush();
            console.err().println("Error: " + e.getMessage());
            console.err().flush();
            return false;
        }
    }
}
