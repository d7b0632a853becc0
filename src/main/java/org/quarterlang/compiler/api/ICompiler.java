package org.quarterlang.compiler.api;

import org.quarterlang.compiler.frontend.parser.ast.ProgramNode;
import org.quarterlang.compiler.ir.IrProgram;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface for the QuarterLang compiler.
 */
public interface ICompiler {

    /**
     * Parses and lowers the given source code into a control-flow-graph program.
     *
     * @param sourceLines A list of strings representing the lines of the source code.
     * @param programName A name for the program, used for diagnostics.
     * @return The lowered {@link IrProgram}.
     * @throws CompilationException if errors occur during parsing or lowering.
     */
    IrProgram compile(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Lowers an already parsed program tree. The tree may come from any conforming parser.
     *
     * @param program The program tree.
     * @param programName A name for the program, used for diagnostics.
     * @return The lowered {@link IrProgram}.
     * @throws CompilationException if the tree cannot be lowered, e.g. because of an unsupported type.
     */
    IrProgram lower(ProgramNode program, String programName) throws CompilationException;

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file.
     * @return The lowered program.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default IrProgram compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readAllLines(programPath), programPath.getFileName().toString());
    }
}
