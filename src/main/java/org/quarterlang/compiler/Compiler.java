package org.quarterlang.compiler;

import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.api.ICompiler;
import org.quarterlang.compiler.diagnostics.Diagnostic;
import org.quarterlang.compiler.diagnostics.DiagnosticsEngine;
import org.quarterlang.compiler.frontend.irgen.IrGenerator;
import org.quarterlang.compiler.frontend.lexer.Lexer;
import org.quarterlang.compiler.frontend.lexer.Token;
import org.quarterlang.compiler.frontend.parser.Parser;
import org.quarterlang.compiler.frontend.parser.ast.ProgramNode;
import org.quarterlang.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline
 * lexing, parsing and lowering. Every call starts with fresh diagnostics;
 * the diagnostics of the most recent call stay available through {@link #getDiagnostics()}.
 * It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * {@inheritDoc}
     */
    @Override
    public IrProgram compile(List<String> sourceLines, String programName) throws CompilationException {
        diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        String fullSource = String.join("\n", sourceLines) + "\n";
        Lexer lexer = new Lexer(fullSource, diagnostics, programName);
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }

        // Phase 2: Parsing (builds the program tree)
        Parser parser = new Parser(tokens, diagnostics);
        ProgramNode program = parser.parse();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }
        LOG.debug("Parsed '{}': {} top-level statement(s)", programName, program.statements().size());

        // Phase 3: Lowering
        return new IrGenerator(diagnostics).generate(program, programName);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public IrProgram lower(ProgramNode program, String programName) throws CompilationException {
        diagnostics = new DiagnosticsEngine();
        return new IrGenerator(diagnostics).generate(program, programName);
    }

    /**
     * @return The diagnostics of the most recent compilation, including warnings.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics.getDiagnostics();
    }
}
