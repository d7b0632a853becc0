package org.quarterlang.console;

import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

public class JLineConsoleTest {

    @Test
    @Tag("integration")
    void openRestoresJLineLogLevel() throws IOException {
        Logger jlineLogger = Logger.getLogger("org.jline");
        Level previous = jlineLogger.getLevel();
        jlineLogger.setLevel(Level.FINE);
        try (JLineConsole console = JLineConsole.open()) {
            assertThat(jlineLogger.getLevel()).isEqualTo(Level.FINE);
            assertThat(console.out()).isNotNull();
        } finally {
            jlineLogger.setLevel(previous);
        }
    }

    @Test
    @Tag("integration")
    void readLineReturnsNullAtEndOfInput() throws IOException {
        Terminal terminal = TerminalBuilder.builder()
                .system(false)
                .dumb(true)
                .streams(new ByteArrayInputStream("print(1)\n".getBytes(StandardCharsets.UTF_8)), new ByteArrayOutputStream())
                .build();

        try (JLineConsole console = new JLineConsole(terminal)) {
            assertThat(console.readLine("qtr> ")).isEqualTo("print(1)");
            assertThat(console.readLine("qtr> ")).isNull();
        }
    }
}
