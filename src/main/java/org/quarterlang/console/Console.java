package org.quarterlang.console;

import java.io.PrintWriter;

/**
 * A line-oriented interactive console shared by the REPL and the debugger.
 */
public interface Console {

    /**
     * Shows the prompt and reads one line of input.
     *
     * @param prompt The prompt to show.
     * @return The line without its terminator, or null when the input has ended or was interrupted.
     */
    String readLine(String prompt);

    /**
     * @return The stream for program output and command results.
     */
    PrintWriter out();

    /**
     * @return The stream for error reports.
     */
    PrintWriter err();
}
