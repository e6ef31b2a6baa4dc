package org.plcore.compiler.frontend.lexer;

/**
 * Exhaustive dispatch over the {@link Token} variants. There is one method per variant and
 * no default, so a new variant cannot be added without updating every implementation.
 *
 * @param <R> The result type.
 */
public interface TokenVisitor<R> {
    R visitName(Token.Name token);

    R visitBuiltinFunctionId(Token.BuiltinFunctionId token);

    R visitBuiltinTypeId(Token.BuiltinTypeId token);

    R visitConArgs(Token.ConArgs token);

    R visitKeyword(Token.KeywordToken token);

    R visitLiteralConst(Token.LiteralConstToken token);

    R visitNatural(Token.Natural token);

    R visitEndOfInput(Token.EndOfInput token);
}
