package org.plcore.compiler.diagnostics;

import org.plcore.compiler.api.CompilerErrorCode;
import org.plcore.compiler.frontend.lexer.SourcePos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) reported
 * while tokens are produced.
 * <p>
 * This decouples error reporting from the token construction logic.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param pos     The position of the offending span.
     */
    public void reportError(CompilerErrorCode code, String message, SourcePos pos) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, pos));
    }

    /**
     * Reports a warning.
     *
     * @param code    The error code.
     * @param message The warning message.
     * @param pos     The position of the offending span.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourcePos pos) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, pos));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
