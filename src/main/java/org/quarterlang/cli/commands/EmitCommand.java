package org.quarterlang.cli.commands;

import com.typesafe.config.ConfigException;
import org.quarterlang.cli.CommandLineInterface;
import org.quarterlang.compiler.Compiler;
import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.backend.emit.MnemonicEmitter;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.compiler.util.IrDump;
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
    name = "emit",
    description = "Compiles a program and prints its mnemonics or its control-flow graph."
)
public class EmitCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The program source file.")
    private File file;

    @Option(names = "--ir", description = "Print the control-flow graph instead of mnemonics.")
    private boolean ir;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            parent.getConfig();
            final IrProgram program = new Compiler().compile(file.toPath());
            out.print(ir ? IrDump.render(program) : new MnemonicEmitter().emit(program));
            out.flush();
            return 0;
        } catch (IOException e) {
            err.println("Error: Cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (CompilationException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
