package org.quarterlang.cli.commands;

import com.typesafe.config.ConfigException;
import org.quarterlang.cli.CommandLineInterface;
import org.quarterlang.compiler.Compiler;
import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.runtime.ExecutionException;
import org.quarterlang.runtime.Interpreter;
import org.quarterlang.runtime.InterpreterOptions;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
    name = "run",
    description = "Compiles a program and runs it once."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

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
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final InterpreterOptions options = parent.interpreterOptions(linear);
            final IrProgram program = new Compiler().compile(file.toPath());
            LOGGER.debug("Running '{}' in {} mode", file, options.mode());
            final long result = new Interpreter(program, BuiltinRegistry.withDefaults(), options, out).run();
            out.flush();
            LOGGER.debug("Program '{}' returned {}", file, result);
            return 0;
        } catch (IOException e) {
            out.flush();
            err.println("Error: Cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (CompilationException | ExecutionException | ConfigException e) {
            out.flush();
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
