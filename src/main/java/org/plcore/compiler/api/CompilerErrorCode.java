package org.plcore.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur in the front end.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Lexical Errors
    /** A span handed to the token factory was empty. */
    EMPTY_LEXEME,
    /** A literal-constant body matched none of the accepted shapes. */
    MALFORMED_LITERAL_CONST,
    /** A natural-number span contained something other than decimal digits. */
    MALFORMED_NATURAL,
    /** A builtin function or type id was blank. */
    MALFORMED_BUILTIN_ID,
    // endregion

    // region Internal Limits
    /** The interner ran out of representable handles. */
    UNIQUE_SPACE_EXHAUSTED,
    // endregion

    // region General Errors
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
