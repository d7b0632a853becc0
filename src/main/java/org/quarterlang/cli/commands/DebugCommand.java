package org.quarterlang.cli.commands;

import com.typesafe.config.ConfigException;
import org.quarterlang.cli.CommandLineInterface;
import org.quarterlang.compiler.Compiler;
import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.console.JLineConsole;
import org.quarterlang.runtime.ExecutionException;
import org.quarterlang.runtime.InterpreterOptions;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.quarterlang.runtime.debug.DebugSession;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "debug",
    description = "Compiles a program and runs it under the single-step debugger."
)
public class DebugCommand implements Callable<Integer> {

    private static final String PROMPT_PATH = "quarterlang.debugger.prompt";

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The program source file.")
    private File file;

    @Option(names = "--linear", description = "Walk blocks in emission order instead of following jumps.")
    private boolean linear;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        final IrProgram program;
        final InterpreterOptions options;
        final String prompt;
        try {
            options = parent.interpreterOptions(linear);
            prompt = parent.getConfig().getString(PROMPT_PATH);
            program = new Compiler().compile(file.toPath());
        } catch (IOException e) {
            err.println("Error: Cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (CompilationException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try (JLineConsole console = JLineConsole.open()) {
            new DebugSession(program, BuiltinRegistry.withDefaults(), options, console, prompt).run();
            return 0;
        } catch (ExecutionException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: Cannot open terminal: " + e.getMessage());
            return 1;
        }
    }
}
