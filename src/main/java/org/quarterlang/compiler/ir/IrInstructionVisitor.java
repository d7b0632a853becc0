package org.quarterlang.compiler.ir;

/**
 * A visitor over all IR instruction kinds.
 *
 * @param <T> The return type of the visit methods.
 */
public interface IrInstructionVisitor<T> {
    T visit(IrAlloc instruction);
    T visit(IrStore instruction);
    T visit(IrArithmetic instruction);
    T visit(IrJump instruction);
    T visit(IrCondJump instruction);
    T visit(IrCall instruction);
    T visit(IrReturn instruction);
}
