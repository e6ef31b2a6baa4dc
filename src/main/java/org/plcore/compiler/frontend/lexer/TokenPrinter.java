package org.plcore.compiler.frontend.lexer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders tokens for diagnostics. The output is not meant to be lexed again.
 */
public final class TokenPrinter implements TokenVisitor<String> {

    /** Shared stateless instance. */
    public static final TokenPrinter INSTANCE = new TokenPrinter();

    private TokenPrinter() {}

    /**
     * Renders a token sequence, separating tokens by a single space and skipping
     * tokens that render as nothing.
     *
     * @param tokens The tokens to render.
     * @return The rendered sequence.
     */
    public static String render(List<? extends Token> tokens) {
        return tokens.stream()
                .map(Token::pretty)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "));
    }

    @Override
    public String visitName(Token.Name token) {
        return token.text();
    }

    @Override
    public String visitBuiltinFunctionId(Token.BuiltinFunctionId token) {
        return token.text();
    }

    @Override
    public String visitBuiltinTypeId(Token.BuiltinTypeId token) {
        return token.text();
    }

    @Override
    public String visitConArgs(Token.ConArgs token) {
        return token.typeName() + " " + token.literal().pretty();
    }

    @Override
    public String visitKeyword(Token.KeywordToken token) {
        return token.keyword().pretty();
    }

    @Override
    public String visitLiteralConst(Token.LiteralConstToken token) {
        return token.literal().pretty();
    }

    @Override
    public String visitNatural(Token.Natural token) {
        return token.value().toString();
    }

    @Override
    public String visitEndOfInput(Token.EndOfInput token) {
        return "";
    }
}
