package org.plcore.compiler.frontend.lexer;

import java.util.Optional;

/**
 * The surface shape of a literal-constant body, as in {@code (con integer 9)} or
 * {@code (con string "Hello")}.
 * <p>
 * The lexer only classifies the shape. The raw characters, including quotes and any escape
 * sequences, are handed on untouched; converting them into a value is up to the parser of the
 * constant's builtin type. Nested parentheses are not supported: the lexer could not tell
 * where a body like {@code (1,")")} ends.
 */
public enum LiteralConst {
    /** {@code ()} */
    EMPTY_BRACKETS("lit ()"),
    /** A single-quoted, possibly empty sequence of printable characters. */
    SINGLE_QUOTED_CHARS("lit '"),
    /** A double-quoted, possibly empty sequence of printable characters. */
    DOUBLE_QUOTED_CHARS("lit \""),
    /**
     * A non-empty sequence of printable characters without {@code (} or {@code )} that does not
     * start with a quote. Inner spaces are kept, leading and trailing spaces are ignored.
     */
    UNQUOTED_CHARS("lit");

    /** Lowest printable code point. Tabs and other control characters fall below it. */
    public static final int MIN_PRINTABLE = 0x20;
    /** Highest printable code point. */
    public static final int MAX_PRINTABLE = 0x10FFFF;

    private final String rendering;

    LiteralConst(String rendering) {
        this.rendering = rendering;
    }

    /**
     * @return The diagnostic rendering of this shape.
     */
    public String pretty() {
        return rendering;
    }

    /**
     * Determines the shape of a literal-constant body. At most one shape matches.
     *
     * @param body The raw body text following the type name.
     * @return The shape, or empty if the body is malformed.
     */
    public static Optional<LiteralConst> classify(String body) {
        String text = trimBody(body);
        if (text.isEmpty() || !isPrintable(text)) {
            return Optional.empty();
        }
        if (text.equals("()")) {
            return Optional.of(EMPTY_BRACKETS);
        }
        char first = text.charAt(0);
        if (first == '\'' || first == '"') {
            boolean closed = text.length() >= 2 && text.charAt(text.length() - 1) == first;
            if (!closed) {
                return Optional.empty();
            }
            return Optional.of(first == '\'' ? SINGLE_QUOTED_CHARS : DOUBLE_QUOTED_CHARS);
        }
        if (text.indexOf('(') >= 0 || text.indexOf(')') >= 0) {
            return Optional.empty();
        }
        return Optional.of(UNQUOTED_CHARS);
    }

    /**
     * @param codePoint A unicode code point.
     * @return Whether the code point may appear in a literal-constant body.
     */
    public static boolean isPrintable(int codePoint) {
        return codePoint >= MIN_PRINTABLE && codePoint <= MAX_PRINTABLE;
    }

    private static boolean isPrintable(String text) {
        return text.codePoints().allMatch(LiteralConst::isPrintable);
    }

    // Only the space character is stripped; a tab at either end makes the body invalid.
    static String trimBody(String text) {
        int begin = 0;
        int end = text.length();
        while (begin < end && text.charAt(begin) == ' ') begin++;
        while (end > begin && text.charAt(end - 1) == ' ') end--;
        return text.substring(begin, end);
    }
}
