package org.plcore.compiler.frontend.lexer;

import org.plcore.compiler.api.Unique;
import org.plcore.compiler.diagnostics.CompilerLogger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Interns identifier texts during one lexing session.
 * <p>
 * The first occurrence of a text is assigned the next free {@link Unique}; every later
 * occurrence of the same text gets that handle back. Handles are allocated densely and in
 * first-seen order. Scoping is not considered: equal spellings anywhere in the session share
 * a handle, and a later phase that needs distinct bindings must rename before interning.
 * <p>
 * Invariants: every handle in the table is below {@link #next()}, no two texts share a handle,
 * and {@link #next()} never decreases.
 * <p>
 * Instances are not thread-safe. Each call observes all earlier calls of the same session, so
 * scanning threads must not share a state without external synchronization.
 */
public final class IdentifierState {

    private final Map<String, Unique> uniques = new LinkedHashMap<>();
    private Unique next;

    private IdentifierState(Unique start) {
        this.next = Objects.requireNonNull(start, "start");
    }

    /**
     * Starts a fresh session whose first handle is {@link Unique#ZERO}.
     * @return A new, empty state.
     */
    public static IdentifierState empty() {
        return new IdentifierState(Unique.ZERO);
    }

    /**
     * Starts a session that continues allocating at {@code start}, e.g. so that a second
     * program does not collide with handles already handed out for a first one.
     * The caller must pick a {@code start} above every handle that has to stay distinct;
     * this is not checked.
     *
     * @param start The first handle to allocate.
     * @return A new, empty state.
     */
    public static IdentifierState from(Unique start) {
        CompilerLogger.debug("Continuing identifier allocation at {}", start);
        return new IdentifierState(start);
    }

    /**
     * Returns the handle for {@code text}, allocating the next one if the text has not been
     * seen in this session. A repeated text leaves the state untouched.
     *
     * @param text The identifier text.
     * @return The handle for the text.
     * @throws org.plcore.compiler.api.InternalCompilerException if no handle is left to allocate.
     *         The state is unchanged in that case.
     */
    public Unique intern(String text) {
        Objects.requireNonNull(text, "text");
        Unique known = uniques.get(text);
        if (known != null) {
            return known;
        }
        Unique allocated = next;
        Unique following = allocated.successor();
        uniques.put(text, allocated);
        next = following;
        CompilerLogger.trace("Interned '{}' as {}", text, allocated);
        return allocated;
    }

    /**
     * @param text The identifier text.
     * @return The handle previously assigned to {@code text}, without allocating.
     */
    public Optional<Unique> lookup(String text) {
        return Optional.ofNullable(uniques.get(text));
    }

    /**
     * @param text The identifier text.
     * @return Whether {@code text} has been interned in this session.
     */
    public boolean contains(String text) {
        return uniques.containsKey(text);
    }

    /**
     * @return The handle the next unseen text will receive. A follow-on session can start here.
     */
    public Unique next() {
        return next;
    }

    /**
     * @return The number of distinct texts interned so far.
     */
    public int size() {
        return uniques.size();
    }

    /**
     * @return An unmodifiable snapshot of the table in first-seen order.
     */
    public Map<String, Unique> entries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(uniques));
    }

    @Override
    public String toString() {
        return "IdentifierState{" + uniques + ", next=" + next + "}";
    }
}
