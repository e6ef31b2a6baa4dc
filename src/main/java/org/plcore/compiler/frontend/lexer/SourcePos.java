package org.plcore.compiler.frontend.lexer;

import java.util.Objects;

/**
 * A position in the source text, attached to every {@link Token}.
 * The front end never interprets it; it is carried verbatim for diagnostics.
 *
 * @param fileName The logical file name the position belongs to.
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 */
public record SourcePos(String fileName, int line, int column) {

    public SourcePos {
        Objects.requireNonNull(fileName, "fileName");
    }

    /**
     * Creates a position at the start of the given file.
     * @param fileName The logical file name.
     * @return The position of line 1, column 1.
     */
    public static SourcePos startOf(String fileName) {
        return new SourcePos(fileName, 1, 1);
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
