package org.quarterlang.runtime;

/**
 * Classifies fatal execution errors.
 */
public enum RuntimeErrorCode {
    FUNCTION_NOT_FOUND,
    UNRESOLVED_OPERAND,
    ARGUMENT_COUNT_MISMATCH,
    DIVISION_BY_ZERO,
    CALL_DEPTH_EXCEEDED,
    ARGUMENT_OUT_OF_RANGE
}
