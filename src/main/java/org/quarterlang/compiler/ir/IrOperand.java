package org.quarterlang.compiler.ir;

/**
 * Base type for instruction operands in the IR. Operands keep their source meaning
 * until execution: a name is resolved against the call stack only when the instruction runs.
 */
public sealed interface IrOperand permits IrImm, IrVar {}
