package org.quarterlang.cli.commands;

import com.typesafe.config.ConfigException;
import org.quarterlang.cli.CommandLineInterface;
import org.quarterlang.console.JLineConsole;
import org.quarterlang.repl.ReplSession;
import org.quarterlang.runtime.InterpreterOptions;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "repl",
    description = "Reads, compiles and runs one line at a time. Type 'exit' or press Ctrl-D to leave."
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplCommand.class);
    private static final String PROMPT_PATH = "quarterlang.repl.prompt";

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--linear", description = "Walk blocks in emission order instead of following jumps.")
    private boolean linear;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        final InterpreterOptions options;
        final String prompt;
        try {
            options = parent.interpreterOptions(linear);
            prompt = parent.getConfig().getString(PROMPT_PATH);
        } catch (ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try (JLineConsole console = JLineConsole.open()) {
            final int failures = new ReplSession(BuiltinRegistry.withDefaults(), options, prompt).run(console);
            LOGGER.debug("REPL finished, {} line(s) failed", failures);
            return 0;
        } catch (IOException e) {
            err.println("Error: Cannot open terminal: " + e.getMessage());
            return 1;
        }
    }
}
