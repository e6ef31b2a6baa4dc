package org.plcore.compiler.diagnostics;

import org.plcore.compiler.api.CompilerErrorCode;
import org.plcore.compiler.frontend.lexer.SourcePos;

/**
 * Represents a single diagnostic message (error or warning)
 * reported while turning source spans into tokens.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The machine-readable error code.
 * @param message The diagnostic message.
 * @param pos The source position the diagnostic refers to.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourcePos pos
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (%s)", type, pos, message, code);
    }
}
