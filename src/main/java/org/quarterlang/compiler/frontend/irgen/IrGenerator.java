package org.quarterlang.compiler.frontend.irgen;

import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.api.SourceInfo;
import org.quarterlang.compiler.diagnostics.DiagnosticsEngine;
import org.quarterlang.compiler.frontend.parser.ast.AssignmentNode;
import org.quarterlang.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.quarterlang.compiler.frontend.parser.ast.BinaryOperator;
import org.quarterlang.compiler.frontend.parser.ast.CallNode;
import org.quarterlang.compiler.frontend.parser.ast.ExpressionNode;
import org.quarterlang.compiler.frontend.parser.ast.ExpressionVisitor;
import org.quarterlang.compiler.frontend.parser.ast.FunctionDefinitionNode;
import org.quarterlang.compiler.frontend.parser.ast.LiteralNode;
import org.quarterlang.compiler.frontend.parser.ast.LoopNode;
import org.quarterlang.compiler.frontend.parser.ast.OperandNode;
import org.quarterlang.compiler.frontend.parser.ast.ProgramNode;
import org.quarterlang.compiler.frontend.parser.ast.ReturnNode;
import org.quarterlang.compiler.frontend.parser.ast.StatementNode;
import org.quarterlang.compiler.frontend.parser.ast.StatementVisitor;
import org.quarterlang.compiler.frontend.parser.ast.ValueDeclarationNode;
import org.quarterlang.compiler.frontend.parser.ast.VariableNode;
import org.quarterlang.compiler.frontend.parser.ast.WhenNode;
import org.quarterlang.compiler.ir.IrAlloc;
import org.quarterlang.compiler.ir.IrArithmetic;
import org.quarterlang.compiler.ir.IrArithmeticOp;
import org.quarterlang.compiler.ir.IrCall;
import org.quarterlang.compiler.ir.IrCondJump;
import org.quarterlang.compiler.ir.IrFunction;
import org.quarterlang.compiler.ir.IrImm;
import org.quarterlang.compiler.ir.IrInstruction;
import org.quarterlang.compiler.ir.IrJump;
import org.quarterlang.compiler.ir.IrOperand;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.compiler.ir.IrReturn;
import org.quarterlang.compiler.ir.IrStore;
import org.quarterlang.compiler.ir.IrVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase: lowers a program tree into a CFG program.
 * <p>
 * Every function definition becomes one {@link IrFunction}; all other top-level statements
 * go into the synthesized entry function {@link IrProgram#ENTRY_FUNCTION}, appended after
 * the user functions. The generator holds no state between calls, so lowering the same tree
 * twice yields equal programs.
 */
public final class IrGenerator {

	/**
	 * The only supported scalar type.
	 */
	public static final String SUPPORTED_TYPE = "int";

	private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

	private final DiagnosticsEngine diagnostics;

	/**
	 * Creates a new IR generator.
	 *
	 * @param diagnostics The diagnostics engine for reporting issues.
	 */
	public IrGenerator(DiagnosticsEngine diagnostics) {
		this.diagnostics = diagnostics;
	}

	/**
	 * Lowers the whole program.
	 *
	 * @param program     The program tree.
	 * @param programName The program name used for IR metadata and diagnostics.
	 * @return The lowered program.
	 * @throws CompilationException if any lowering error was reported. No partial program is returned.
	 */
	public IrProgram generate(ProgramNode program, String programName) throws CompilationException {
		Map<String, IrFunction> functions = new LinkedHashMap<>();
		List<StatementNode> topLevel = new ArrayList<>();
		try {
			for (StatementNode statement : program.statements()) {
				if (statement instanceof FunctionDefinitionNode) {
					FunctionDefinitionNode definition = (FunctionDefinitionNode) statement;
					if (functions.containsKey(definition.name())) {
						error("Function '" + definition.name() + "' is already defined.", definition.source(), programName);
						continue;
					}
					functions.put(definition.name(), lowerFunction(definition.name(), definition.parameters(), definition.body(), programName));
				} else {
					topLevel.add(statement);
				}
			}
			functions.put(IrProgram.ENTRY_FUNCTION, lowerFunction(IrProgram.ENTRY_FUNCTION, List.of(), topLevel, programName));
		} catch (LoweringAbortedException e) {
			LOG.debug("Lowering of '{}' aborted: {}", programName, e.getMessage());
			throw new CompilationException(diagnostics.summary());
		}

		if (diagnostics.hasErrors()) {
			throw new CompilationException(diagnostics.summary());
		}
		LOG.debug("Lowered program '{}' into {} function(s)", programName, functions.size());
		return new IrProgram(programName, functions);
	}

	private IrFunction lowerFunction(String name, List<String> parameters, List<StatementNode> body, String programName) {
		IrGenContext ctx = new IrGenContext(name, parameters);
		StatementLowering lowering = new StatementLowering(ctx, programName);
		for (StatementNode statement : body) {
			lowering.lower(statement);
		}
		IrFunction function = ctx.build();
		LOG.trace("Lowered function '{}': {} block(s), {} slot(s)", name, function.blocks().size(), function.slotCount());
		return function;
	}

	private void error(String message, SourceInfo source, String programName) {
		diagnostics.reportError(message, fileOf(source, programName), source.lineNumber());
	}

	private static String fileOf(SourceInfo source, String programName) {
		return source == SourceInfo.UNKNOWN ? programName : source.fileName();
	}

	private static IrArithmeticOp toIrOp(BinaryOperator operator) {
		switch (operator) {
			case ADD: return IrArithmeticOp.ADD;
			case SUBTRACT: return IrArithmeticOp.SUBTRACT;
			case MULTIPLY: return IrArithmeticOp.MULTIPLY;
			case DIVIDE: return IrArithmeticOp.DIVIDE;
			default: throw new IllegalStateException("Unknown operator: " + operator);
		}
	}

	/**
	 * Lowers the statements of one function body into its context.
	 */
	private final class StatementLowering implements StatementVisitor<Void> {

		private final IrGenContext ctx;
		private final String programName;
		private SourceInfo current = SourceInfo.UNKNOWN;

		StatementLowering(IrGenContext ctx, String programName) {
			this.ctx = ctx;
			this.programName = programName;
		}

		/**
		 * Lowers one statement, remembering its position for operand diagnostics.
		 */
		void lower(StatementNode statement) {
			current = statement.source();
			statement.accept(this);
		}

		@Override
		public Void visit(ValueDeclarationNode node) {
			if (!SUPPORTED_TYPE.equals(node.declaredType())) {
				error("Unsupported type '" + node.declaredType() + "' for value '" + node.name()
						+ "'. Only '" + SUPPORTED_TYPE + "' is supported.", node.source(), programName);
				throw new LoweringAbortedException("unsupported type '" + node.declaredType() + "'");
			}
			int slot = ctx.declare(node.name());
			ctx.emit(new IrAlloc(node.name(), slot));
			lowerInto(node.name(), node.initializer());
			return null;
		}

		@Override
		public Void visit(AssignmentNode node) {
			if (!ctx.isDeclared(node.name())) {
				error("Undeclared variable '" + node.name() + "'.", node.source(), programName);
				return null;
			}
			lowerInto(node.name(), node.value());
			return null;
		}

		@Override
		public Void visit(FunctionDefinitionNode node) {
			error("Function '" + node.name() + "' must be defined at top level.", node.source(), programName);
			return null;
		}

		@Override
		public Void visit(CallNode node) {
			ctx.emit(new IrCall(node.callee(), lowerArguments(node), null));
			return null;
		}

		@Override
		public Void visit(LoopNode node) {
			int index = ctx.nextLoopIndex();
			String condition = "loop.cond." + index;
			String body = "loop.body." + index;
			String exit = "loop.exit." + index;

			String counter = node.counterName();
			if (counter == null) {
				counter = ctx.isDeclared("i") ? "i_" + index : "i";
			}
			int slot = ctx.declare(counter);
			ctx.emit(new IrAlloc(counter, slot));
			ctx.emit(new IrStore(counter, operand(node.start())));
			ctx.emit(new IrJump(condition));

			ctx.openBlock(condition);
			ctx.emit(new IrCondJump(new IrVar(counter), operand(node.end()), body));
			ctx.emit(new IrJump(exit));

			ctx.openBlock(body);
			for (StatementNode statement : node.body()) {
				lower(statement);
			}
			ctx.emit(new IrArithmetic(IrArithmeticOp.ADD, counter, new IrVar(counter), new IrImm(1)));
			ctx.emit(new IrJump(condition));

			ctx.openBlock(exit);
			return null;
		}

		@Override
		public Void visit(WhenNode node) {
			int index = ctx.nextWhenIndex();
			String then = "when.then." + index;
			String end = "when.end." + index;

			ctx.emit(new IrCondJump(operand(node.left()), operand(node.right()), end));
			ctx.openBlock(then);
			for (StatementNode statement : node.body()) {
				lower(statement);
			}
			ctx.openBlock(end);
			return null;
		}

		@Override
		public Void visit(ReturnNode node) {
			ExpressionNode value = node.value();
			if (value == null) {
				ctx.emit(new IrReturn(null));
			} else if (value instanceof OperandNode) {
				ctx.emit(new IrReturn(operand((OperandNode) value)));
			} else {
				String temp = ctx.nextTempName();
				int slot = ctx.declare(temp);
				ctx.emit(new IrAlloc(temp, slot));
				lowerInto(temp, value);
				ctx.emit(new IrReturn(new IrVar(temp)));
			}
			return null;
		}

		/**
		 * Lowers an expression so that its value ends up in the given variable.
		 */
		private void lowerInto(String destination, ExpressionNode expression) {
			ctx.emit(expression.accept(new ExpressionVisitor<>() {
				@Override
				public IrInstruction visit(LiteralNode node) {
					return new IrStore(destination, operand(node));
				}

				@Override
				public IrInstruction visit(VariableNode node) {
					return new IrStore(destination, operand(node));
				}

				@Override
				public IrInstruction visit(BinaryExpressionNode node) {
					return new IrArithmetic(toIrOp(node.operator()), destination, operand(node.left()), operand(node.right()));
				}

				@Override
				public IrInstruction visit(CallNode node) {
					return new IrCall(node.callee(), lowerArguments(node), destination);
				}
			}));
		}

		/**
		 * Keeps the literal and name arguments of a call in order. Other arguments are dropped with a warning.
		 */
		private List<IrOperand> lowerArguments(CallNode call) {
			List<IrOperand> arguments = new ArrayList<>();
			for (int i = 0; i < call.arguments().size(); i++) {
				ExpressionNode argument = call.arguments().get(i);
				if (argument instanceof OperandNode) {
					arguments.add(operand((OperandNode) argument));
				} else {
					String message = "Argument " + (i + 1) + " of call to '" + call.callee()
							+ "' is neither a literal nor a name and is dropped.";
					diagnostics.reportWarning(message, fileOf(call.source(), programName), call.source().lineNumber());
					LOG.warn("{} ({}:{})", message, fileOf(call.source(), programName), call.source().lineNumber());
				}
			}
			return arguments;
		}

		private IrOperand operand(OperandNode node) {
			if (node instanceof LiteralNode) {
				String text = ((LiteralNode) node).text();
				try {
					return new IrImm(Long.parseLong(text));
				} catch (NumberFormatException e) {
					String message = text.matches("-?\\d+")
							? "Integer literal out of range: " + text
							: "Invalid integer literal: '" + text + "'.";
					error(message, current, programName);
					return new IrImm(0);
				}
			}
			String name = ((VariableNode) node).name();
			if (!ctx.isDeclared(name)) {
				LOG.debug("Name '{}' is not declared in '{}'; it is resolved at execution time", name, ctx.functionName());
			}
			return new IrVar(name);
		}
	}

	/**
	 * Aborts the whole lowering pass after a fatal error has been reported.
	 */
	private static final class LoweringAbortedException extends RuntimeException {
		LoweringAbortedException(String message) {
			super(message);
		}
	}
}
