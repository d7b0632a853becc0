package org.quarterlang.compiler.util;

import org.quarterlang.compiler.ir.IrBasicBlock;
import org.quarterlang.compiler.ir.IrFunction;
import org.quarterlang.compiler.ir.IrInstruction;
import org.quarterlang.compiler.ir.IrProgram;

import java.util.stream.Collectors;

/**
 * Utility class for rendering a CFG program as readable text.
 */
public final class IrDump {

	private IrDump() {}

	/**
	 * Renders all functions in emission order, with their slots, blocks and instructions.
	 * @param program The program to render.
	 * @return The text, one instruction per line.
	 */
	public static String render(IrProgram program) {
		StringBuilder sb = new StringBuilder();
		sb.append("; program ").append(program.programName()).append('\n');
		for (IrFunction function : program.functions().values()) {
			sb.append('\n');
			sb.append("function ").append(function.name())
					.append('(').append(String.join(", ", function.parameters())).append(')')
					.append(" slots=").append(function.slotCount()).append('\n');
			if (!function.slots().isEmpty()) {
				sb.append("  ; ").append(function.slots().entrySet().stream()
						.map(e -> e.getKey() + "@" + e.getValue())
						.collect(Collectors.joining(", "))).append('\n');
			}
			for (IrBasicBlock block : function.blocks()) {
				sb.append("  ").append(block.name()).append(":\n");
				for (IrInstruction instruction : block.instructions()) {
					sb.append("    ").append(instruction).append('\n');
				}
			}
		}
		return sb.toString();
	}
}
