package org.quarterlang.runtime;

/**
 * A fatal error raised while executing a CFG program. It unwinds through all
 * active calls up to the driver; mutations made before the error are kept.
 */
public class ExecutionException extends RuntimeException {

    private final RuntimeErrorCode code;

    /**
     * @param code The error classification.
     * @param message A description of the error.
     */
    public ExecutionException(RuntimeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RuntimeErrorCode getCode() {
        return code;
    }
}
