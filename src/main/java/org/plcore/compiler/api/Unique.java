package org.plcore.compiler.api;

/**
 * An opaque handle identifying one distinct identifier spelling within a lexing session.
 * <p>
 * Handles are densely allocated, non-negative and totally ordered. They support equality and
 * ordering only, never arithmetic.
 *
 * @param value The raw handle value, never negative.
 */
public record Unique(int value) implements Comparable<Unique> {

    /** The first handle of a fresh session. */
    public static final Unique ZERO = new Unique(0);

    public Unique {
        if (value < 0) {
            throw new IllegalArgumentException("Unique must not be negative: " + value);
        }
    }

    /**
     * Returns the handle directly following this one.
     *
     * @return The successor handle.
     * @throws InternalCompilerException if this is the largest representable handle.
     */
    public Unique successor() {
        if (value == Integer.MAX_VALUE) {
            throw new InternalCompilerException(CompilerErrorCode.UNIQUE_SPACE_EXHAUSTED,
                    "No unique handles left after " + value);
        }
        return new Unique(value + 1);
    }

    @Override
    public int compareTo(Unique other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
