package org.plcore.compiler.frontend.lexer;

import org.plcore.compiler.api.CompilerErrorCode;
import org.plcore.compiler.diagnostics.DiagnosticsEngine;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns spans sliced by the scanner into {@link Token}s.
 * <p>
 * Identifier spans are interned through the session's {@link IdentifierState}; keyword,
 * builtin and literal spans are wrapped directly. Malformed spans are reported to the
 * {@link DiagnosticsEngine} and produce no token.
 */
public class TokenFactory {

    private final IdentifierState identifiers;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param identifiers The interner of the current session.
     * @param diagnostics The engine for reporting malformed spans.
     */
    public TokenFactory(IdentifierState identifiers, DiagnosticsEngine diagnostics) {
        this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Classifies an identifier-shaped span: reserved words become keyword tokens,
     * everything else is interned as a name.
     *
     * @param text The span.
     * @param pos Its position.
     * @return The keyword or name token, or empty if the span is empty.
     */
    public Optional<Token> word(String text, SourcePos pos) {
        Optional<Keyword> keyword = Keyword.fromSpelling(text);
        if (keyword.isPresent()) {
            return Optional.of(new Token.KeywordToken(pos, keyword.get()));
        }
        return name(text, pos);
    }

    /**
     * Interns {@code text} and wraps the handle in a name token, bypassing the keyword check.
     *
     * @param text The identifier text.
     * @param pos Its position.
     * @return The name token, or empty if the span is empty. Empty spans are not interned.
     */
    public Optional<Token> name(String text, SourcePos pos) {
        if (text.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.EMPTY_LEXEME, "Expected an identifier", pos);
            return Optional.empty();
        }
        return Optional.of(new Token.Name(pos, text, identifiers.intern(text)));
    }

    /**
     * @param text The span following {@code builtin}.
     * @param pos Its position.
     * @return The builtin function id, or empty if the span is blank.
     */
    public Optional<Token> builtinFunction(String text, SourcePos pos) {
        if (!isBuiltinId(text, pos)) {
            return Optional.empty();
        }
        return Optional.of(new Token.BuiltinFunctionId(pos, text));
    }

    /**
     * @param text The builtin type name.
     * @param pos Its position.
     * @return The builtin type id, or empty if the span is blank.
     */
    public Optional<Token> builtinType(String text, SourcePos pos) {
        if (!isBuiltinId(text, pos)) {
            return Optional.empty();
        }
        return Optional.of(new Token.BuiltinTypeId(pos, text));
    }

    /**
     * Builds the tokens following {@code con} when a constant body is present: the
     * con-arguments token naming the type and the body's shape, then the literal-constant
     * token carrying the raw body for the type's own parser.
     *
     * @param typeName The builtin type name.
     * @param body The raw constant body.
     * @param pos The position of the type name.
     * @return Both tokens in stream order, or an empty list if the type name or the body is malformed.
     */
    public List<Token> conArgs(String typeName, String body, SourcePos pos) {
        if (!isBuiltinId(typeName, pos)) {
            return List.of();
        }
        return classify(body, pos)
                .map(literal -> List.<Token>of(
                        new Token.ConArgs(pos, typeName, literal),
                        new Token.LiteralConstToken(pos, literal, LiteralConst.trimBody(body))))
                .orElse(List.of());
    }

    /**
     * @param body The raw constant body.
     * @param pos Its position.
     * @return The literal-constant token carrying the trimmed raw body, or empty if malformed.
     */
    public Optional<Token> literal(String body, SourcePos pos) {
        return classify(body, pos).map(literal -> new Token.LiteralConstToken(pos, literal, LiteralConst.trimBody(body)));
    }

    /**
     * @param digits A span of decimal digits.
     * @param pos Its position.
     * @return The natural-number token, or empty if the span is not a run of decimal digits.
     */
    public Optional<Token> natural(String digits, SourcePos pos) {
        if (digits.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.EMPTY_LEXEME, "Expected a natural number", pos);
            return Optional.empty();
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                diagnostics.reportError(CompilerErrorCode.MALFORMED_NATURAL,
                        "Invalid natural number: " + digits, pos);
                return Optional.empty();
            }
        }
        return Optional.of(new Token.Natural(pos, new BigInteger(digits)));
    }

    /**
     * @param pos The position just past the input.
     * @return The end-of-input token.
     */
    public Token endOfInput(SourcePos pos) {
        return new Token.EndOfInput(pos);
    }

    private Optional<LiteralConst> classify(String body, SourcePos pos) {
        Optional<LiteralConst> literal = LiteralConst.classify(body);
        if (literal.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.MALFORMED_LITERAL_CONST,
                    "Malformed literal constant: " + body, pos);
        }
        return literal;
    }

    private boolean isBuiltinId(String text, SourcePos pos) {
        if (text.isBlank()) {
            diagnostics.reportError(CompilerErrorCode.MALFORMED_BUILTIN_ID, "Expected a builtin id", pos);
            return false;
        }
        return true;
    }
}
