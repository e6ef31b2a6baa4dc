package org.plcore.compiler.api;

import org.plcore.compiler.frontend.lexer.SourcePos;

/**
 * An exception that is thrown when one or more errors were reported for the source program.
 * <p>
 * It is part of the public API and hides the internal diagnostic types of the front end.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and source position.
     * @param message The detail message.
     * @param pos The position the error refers to.
     */
    public CompilationException(String message, SourcePos pos) {
        super(String.format("%s at %s", message, pos), null);
    }
}
