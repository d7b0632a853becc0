package org.quarterlang.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

public class CommandLineInterfaceTest {

    @Test
    @Tag("unit")
    void registersAllSubcommands() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());

        assertThat(cmd.getCommandName()).isEqualTo("quarterlang");
        assertThat(cmd.getSubcommands().keySet()).containsExactly("run", "debug", "repl", "emit", "help");
    }

    @Test
    @Tag("unit")
    void helpListsSubcommands() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Usage: quarterlang")
                .contains("run")
                .contains("debug")
                .contains("repl")
                .contains("emit");
    }

    @Test
    @Tag("unit")
    void rejectsUnknownSubcommand() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        StringWriter err = new StringWriter();
        cmd.setErr(new PrintWriter(err));

        int exitCode = cmd.execute("compile");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("compile");
    }
}
