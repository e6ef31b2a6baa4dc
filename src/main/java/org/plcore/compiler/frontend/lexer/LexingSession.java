package org.plcore.compiler.frontend.lexer;

import org.plcore.compiler.api.CompilationException;
import org.plcore.compiler.api.Unique;
import org.plcore.compiler.diagnostics.CompilerLogger;
import org.plcore.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One run of the scanner from an initial identifier state to the end of the token stream.
 * <p>
 * The scanner feeds spans in source order through the {@code add...} methods; the session
 * classifies them with its {@link TokenFactory} and collects the resulting tokens.
 * {@link #finish(SourcePos)} terminates the stream. A session is single-threaded and used once.
 */
public class LexingSession {

    private final String fileName;
    private final IdentifierState identifiers;
    private final DiagnosticsEngine diagnostics;
    private final TokenFactory factory;
    private final List<Token> tokens = new ArrayList<>();
    private boolean finished = false;

    /**
     * Creates a session around an existing interner and diagnostics engine.
     *
     * @param fileName The logical file name, for diagnostics.
     * @param identifiers The interner this session allocates from.
     * @param diagnostics The engine for reporting malformed spans.
     */
    public LexingSession(String fileName, IdentifierState identifiers, DiagnosticsEngine diagnostics) {
        this.fileName = fileName;
        this.identifiers = identifiers;
        this.diagnostics = diagnostics;
        this.factory = new TokenFactory(identifiers, diagnostics);
        CompilerLogger.debug("Lexing session for {} starts at {}", fileName, identifiers.next());
    }

    /**
     * Starts a session as configured. Applies the configured log level.
     *
     * @param settings The lexer settings.
     * @return A new session.
     */
    public static LexingSession start(LexerSettings settings) {
        CompilerLogger.setLevel(settings.logLevel());
        IdentifierState identifiers = settings.uniqueStart().equals(Unique.ZERO)
                ? IdentifierState.empty()
                : IdentifierState.from(settings.uniqueStart());
        return new LexingSession(settings.fileName(), identifiers, new DiagnosticsEngine());
    }

    /**
     * Starts a fresh session whose handles begin at zero.
     *
     * @param fileName The logical file name.
     * @return A new session.
     */
    public static LexingSession start(String fileName) {
        return new LexingSession(fileName, IdentifierState.empty(), new DiagnosticsEngine());
    }

    /**
     * Starts a session whose handles do not collide with those of an earlier one.
     *
     * @param fileName The logical file name.
     * @param start The first handle to allocate, typically {@link #nextUnique()} of the earlier session.
     * @return A new session.
     */
    public static LexingSession continuing(String fileName, Unique start) {
        return new LexingSession(fileName, IdentifierState.from(start), new DiagnosticsEngine());
    }

    /**
     * Appends a keyword or name via {@link TokenFactory#word}. An empty span is reported, not thrown.
     */
    public LexingSession addWord(String text, SourcePos pos) {
        ensureOpen();
        factory.word(text, pos).ifPresent(tokens::add);
        return this;
    }

    /**
     * Appends a name via {@link TokenFactory#name}, skipping the keyword check. An empty span is reported, not thrown.
     */
    public LexingSession addName(String text, SourcePos pos) {
        ensureOpen();
        factory.name(text, pos).ifPresent(tokens::add);
        return this;
    }

    /**
     * Appends a builtin function id via {@link TokenFactory#builtinFunction}. A blank span is reported, not thrown.
     */
    public LexingSession addBuiltinFunction(String text, SourcePos pos) {
        ensureOpen();
        factory.builtinFunction(text, pos).ifPresent(tokens::add);
        return this;
    }

    /**
     * Appends a builtin type id via {@link TokenFactory#builtinType}. A blank span is reported, not thrown.
     */
    public LexingSession addBuiltinType(String text, SourcePos pos) {
        ensureOpen();
        factory.builtinType(text, pos).ifPresent(tokens::add);
        return this;
    }

    /**
     * Appends the con-arguments token and the raw literal body via {@link TokenFactory#conArgs}.
     * A malformed type name or body is reported, not thrown, and appends nothing.
     */
    public LexingSession addConArgs(String typeName, String body, SourcePos pos) {
        ensureOpen();
        tokens.addAll(factory.conArgs(typeName, body, pos));
        return this;
    }

    /**
     * Appends a literal constant via {@link TokenFactory#literal}. A malformed body is reported, not thrown.
     */
    public LexingSession addLiteral(String body, SourcePos pos) {
        ensureOpen();
        factory.literal(body, pos).ifPresent(tokens::add);
        return this;
    }

    /**
     * Appends a natural number via {@link TokenFactory#natural}. A malformed span is reported, not thrown.
     */
    public LexingSession addNatural(String digits, SourcePos pos) {
        ensureOpen();
        factory.natural(digits, pos).ifPresent(tokens::add);
        return this;
    }

    /**
     * Terminates the token stream.
     *
     * @param end The position just past the last character.
     * @return The complete token stream, ending with {@link Token.EndOfInput}.
     * @throws CompilationException if any span was malformed.
     */
    public List<Token> finish(SourcePos end) throws CompilationException {
        ensureOpen();
        finished = true;
        tokens.add(factory.endOfInput(end));
        CompilerLogger.debug("Lexing session for {} produced {} tokens, {} distinct identifiers",
                fileName, tokens.size(), identifiers.size());
        if (diagnostics.hasErrors()) {
            CompilerLogger.warn("Lexing {} failed with {} diagnostics", fileName, diagnostics.getDiagnostics().size());
            throw new CompilationException("Lexing " + fileName + " failed:\n" + diagnostics.summary());
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * @return The tokens collected so far.
     */
    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    /**
     * @return The interner of this session.
     */
    public IdentifierState identifierState() {
        return identifiers;
    }

    /**
     * @return The first handle a follow-on session may allocate without colliding with this one.
     */
    public Unique nextUnique() {
        return identifiers.next();
    }

    /**
     * @return The diagnostics reported so far.
     */
    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * @return The logical file name of this session.
     */
    public String fileName() {
        return fileName;
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Lexing session for " + fileName + " is already finished");
        }
    }
}
