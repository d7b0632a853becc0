package org.quarterlang.runtime.debug;

import org.quarterlang.console.Console;
import org.quarterlang.runtime.CallFrame;
import org.quarterlang.runtime.CallStack;
import org.quarterlang.runtime.ExecutionListener;
import org.quarterlang.runtime.ExecutionPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * An interactive single-step debugger. Before each instruction it shows the instruction
 * and blocks on the console until the operator steps, continues or quits.
 * <p>
 * Commands:
 * <ul>
 *     <li>{@code step}, {@code s} or an empty line: execute this instruction and pause at the next.</li>
 *     <li>{@code inspect}, {@code i}: print the bindings of the current frame.</li>
 *     <li>{@code backtrace}, {@code bt}: print all active frames, innermost first.</li>
 *     <li>{@code continue}, {@code c}: stop pausing and run to the end.</li>
 *     <li>{@code quit}, {@code q}: abort the session. End of input does the same.</li>
 *     <li>{@code help}, {@code h}: list the commands.</li>
 * </ul>
 */
public class Debugger implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(Debugger.class);

    private final Console console;
    private final String prompt;
    private boolean continuing = false;

    /**
     * @param console The console to interact on.
     * @param prompt The prompt shown while paused.
     */
    public Debugger(Console console, String prompt) {
        this.console = console;
        this.prompt = prompt;
    }

    @Override
    public void beforeInstruction(ExecutionPoint point, CallStack callStack) {
        if (continuing) {
            return;
        }
        PrintWriter out = console.out();
        out.println(point);
        out.flush();
        while (true) {
            String line = console.readLine(prompt);
            if (line == null) {
                throw new DebugSessionAbortedException("Debug session ended: end of input.");
            }
            String command = line.trim().toLowerCase(Locale.ROOT);
            switch (command) {
                case "":
                case "s":
                case "step":
                    return;
                case "i":
                case "inspect":
                    printBindings(callStack.top(), out);
                    break;
                case "bt":
                case "backtrace":
                    printBacktrace(callStack.frames(), out);
                    break;
                case "c":
                case "continue":
                    continuing = true;
                    log.debug("Continuing without pausing from {}", point);
                    return;
                case "q":
                case "quit":
                    throw new DebugSessionAbortedException("Debug session aborted.");
                case "h":
                case "help":
                    printHelp(out);
                    break;
                default:
                    out.println("Unknown command: " + command + ". Type 'help' for a list of commands.");
                    break;
            }
            out.flush();
        }
    }

    private void printBindings(CallFrame frame, PrintWriter out) {
        Map<String, Long> bindings = frame.bindings();
        if (bindings.isEmpty()) {
            out.println("(no bindings)");
            return;
        }
        bindings.forEach((name, value) -> out.println(name + " = " + value));
    }

    private void printBacktrace(List<CallFrame> frames, PrintWriter out) {
        for (int i = 0; i < frames.size(); i++) {
            out.println("#" + i + " " + frames.get(i));
        }
    }

    private void printHelp(PrintWriter out) {
        out.println("Available commands:");
        out.println("  step, s, <enter> - Execute this instruction");
        out.println("  inspect, i       - Show the bindings of the current frame");
        out.println("  backtrace, bt    - Show all active frames");
        out.println("  continue, c      - Run to the end without pausing");
        out.println("  quit, q          - Abort the debug session");
        out.println("  help, h          - Show this help");
    }
}
