package org.quarterlang.compiler.frontend.irgen;

import org.quarterlang.compiler.ir.IrBasicBlock;
import org.quarterlang.compiler.ir.IrFunction;
import org.quarterlang.compiler.ir.IrInstruction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-function state used while lowering one function body.
 * Assigns slots, opens blocks, numbers loop/when labels and compiler temporaries,
 * and collects emitted instructions.
 */
public final class IrGenContext {

	/**
	 * Name of the block every function starts with.
	 */
	public static final String ENTRY_BLOCK = "entry";

	private final String functionName;
	private final List<String> parameters;
	private final Map<String, Integer> slots = new LinkedHashMap<>();
	private final List<String> blockNames = new ArrayList<>();
	private final List<List<IrInstruction>> blockInstructions = new ArrayList<>();
	private int nextSlot = 0;
	private int loopCounter = 0;
	private int whenCounter = 0;
	private int tempCounter = 0;

	/**
	 * Creates the context for one function. Parameters take slots {@code 0..n-1} in order,
	 * and the entry block is opened.
	 *
	 * @param functionName The function name.
	 * @param parameters The parameter names in declaration order.
	 */
	public IrGenContext(String functionName, List<String> parameters) {
		this.functionName = functionName;
		this.parameters = List.copyOf(parameters);
		for (String parameter : parameters) {
			declare(parameter);
		}
		openBlock(ENTRY_BLOCK);
	}

	public String functionName() {
		return functionName;
	}

	/**
	 * Assigns the next free slot to the name. A name that is already declared is rebound
	 * to the fresh slot; the old slot stays allocated.
	 *
	 * @param name The variable name.
	 * @return The assigned slot.
	 */
	public int declare(String name) {
		int slot = nextSlot++;
		slots.put(name, slot);
		return slot;
	}

	public boolean isDeclared(String name) {
		return slots.containsKey(name);
	}

	/**
	 * Emits an instruction into the currently open block.
	 * @param instruction The instruction to append.
	 */
	public void emit(IrInstruction instruction) {
		blockInstructions.get(blockInstructions.size() - 1).add(instruction);
	}

	/**
	 * Opens a new block. All following instructions go into it.
	 * @param name The block name, unique within the function.
	 */
	public void openBlock(String name) {
		if (blockNames.contains(name)) {
			throw new IllegalStateException("Block '" + name + "' already exists in function '" + functionName + "'.");
		}
		blockNames.add(name);
		blockInstructions.add(new ArrayList<>());
	}

	/**
	 * @return The next loop label number of this function.
	 */
	public int nextLoopIndex() {
		return loopCounter++;
	}

	/**
	 * @return The next when label number of this function.
	 */
	public int nextWhenIndex() {
		return whenCounter++;
	}

	/**
	 * Creates the name of a compiler temporary. It starts with {@code $} so it cannot clash with source names.
	 * @return A fresh temporary name.
	 */
	public String nextTempName() {
		return "$t" + tempCounter++;
	}

	/**
	 * Freezes the collected state into an immutable function.
	 * @return The lowered function.
	 */
	public IrFunction build() {
		List<IrBasicBlock> blocks = new ArrayList<>();
		for (int i = 0; i < blockNames.size(); i++) {
			blocks.add(new IrBasicBlock(blockNames.get(i), blockInstructions.get(i)));
		}
		return new IrFunction(functionName, parameters, slots, nextSlot, blocks);
	}
}
