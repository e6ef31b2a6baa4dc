package org.plcore.compiler.frontend.lexer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The reserved words of the language. Some of them only occur in the typed or in the
 * untyped dialect, but both dialects share one lexer and therefore one enumeration.
 */
public enum Keyword {
    /** {@code (lam x ty body)} */
    LAM("lam"),
    /** {@code (program version term)} */
    PROGRAM("program"),
    /** {@code (con tyname)} or {@code (con tyname const)}. The next span is a builtin type id. */
    CON("con"),
    /** The next span is a builtin function id rather than a name. */
    BUILTIN("builtin"),
    ERROR("error"),

    // Typed dialect only.
    ABS("abs"),
    FUN("fun"),
    ALL("all"),
    TYPE("type"),
    IFIX("ifix"),
    IWRAP("iwrap"),
    UNWRAP("unwrap"),

    // Untyped dialect only.
    FORCE("force"),
    DELAY("delay");

    private static final List<Keyword> ALL_KEYWORDS = List.of(values());
    private static final Map<String, Keyword> BY_SPELLING = new HashMap<>();

    static {
        for (Keyword keyword : ALL_KEYWORDS) {
            BY_SPELLING.put(keyword.spelling, keyword);
        }
    }

    private final String spelling;

    Keyword(String spelling) {
        this.spelling = spelling;
    }

    /**
     * Returns the canonical source spelling, for diagnostics.
     * @return The keyword as it is written in source text.
     */
    public String pretty() {
        return spelling;
    }

    /**
     * Returns every keyword in declaration order. This list is the lexer's keyword table.
     * @return An unmodifiable list of all keywords.
     */
    public static List<Keyword> allKeywords() {
        return ALL_KEYWORDS;
    }

    /**
     * Looks up the keyword spelled exactly like {@code text}.
     * @param text The candidate span.
     * @return The keyword, or empty if the text is not reserved.
     */
    public static Optional<Keyword> fromSpelling(String text) {
        return Optional.ofNullable(BY_SPELLING.get(text));
    }
}
