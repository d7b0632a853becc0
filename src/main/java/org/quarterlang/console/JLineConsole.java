package org.quarterlang.console;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * A console on a JLine terminal with line editing and history.
 * Ctrl-C and Ctrl-D both end the input.
 */
public class JLineConsole implements Console, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JLineConsole.class);

    private final Terminal terminal;
    private final LineReader lineReader;
    private final PrintWriter err;

    JLineConsole(Terminal terminal) {
        this.terminal = terminal;
        this.lineReader = LineReaderBuilder.builder()
                .terminal(terminal)
                .history(new DefaultHistory())
                .build();
        this.err = new PrintWriter(System.err, true);
    }

    /**
     * Opens the system terminal, falling back to a dumb terminal where none is available
     * (e.g. when input is piped or inside an IDE).
     *
     * @return The console.
     * @throws IOException if not even a dumb terminal can be created.
     */
    public static JLineConsole open() throws IOException {
        Terminal terminal;
        // Temporarily suppress JLine warnings
        java.util.logging.Logger jlineLogger = java.util.logging.Logger.getLogger("org.jline");
        java.util.logging.Level originalLevel = jlineLogger.getLevel();
        jlineLogger.setLevel(java.util.logging.Level.SEVERE);
        try {
            terminal = TerminalBuilder.builder()
                    .system(true)
                    .build();
        } catch (IOException | IllegalStateException e) {
            log.debug("System terminal not available, using a dumb terminal: {}", e.getMessage());
            terminal = TerminalBuilder.builder()
                    .dumb(true)
                    .build();
        } finally {
            jlineLogger.setLevel(originalLevel);
        }
        return new JLineConsole(terminal);
    }

    @Override
    public String readLine(String prompt) {
        try {
            return lineReader.readLine(prompt);
        } catch (UserInterruptException e) {
            // Ctrl+C
            return null;
        } catch (EndOfFileException e) {
            // Ctrl+D
            return null;
        }
    }

    @Override
    public PrintWriter out() {
        return terminal.writer();
    }

    @Override
    public PrintWriter err() {
        return err;
    }

    @Override
    public void close() throws IOException {
        terminal.flush();
        terminal.close();
    }
}
