package org.plcore.compiler.api;

/**
 * Signals a failure inside the compiler itself, as opposed to an error in the source program.
 * Such failures end the session and are never recovered from.
 */
public class InternalCompilerException extends RuntimeException {

    private final CompilerErrorCode code;

    /**
     * @param code The error code classifying the failure.
     * @param message The detail message.
     */
    public InternalCompilerException(CompilerErrorCode code, String message) {
        super(String.format("[%s] %s", code, message));
        this.code = code;
    }

    /**
     * @return The error code classifying the failure.
     */
    public CompilerErrorCode getCode() {
        return code;
    }
}
