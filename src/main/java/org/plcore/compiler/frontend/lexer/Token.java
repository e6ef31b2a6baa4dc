package org.plcore.compiler.frontend.lexer;

import org.plcore.compiler.api.Unique;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A single lexical item. The set of variants is closed and mirrors the fixed grammar:
 * consumers dispatch over it with a {@link TokenVisitor}, so adding a variant breaks every
 * consumer at compile time.
 */
public sealed interface Token permits Token.Name, Token.BuiltinFunctionId, Token.BuiltinTypeId,
        Token.ConArgs, Token.KeywordToken, Token.LiteralConstToken, Token.Natural, Token.EndOfInput {

    /**
     * @return The position of the first character of the token.
     */
    SourcePos pos();

    /**
     * Dispatches to the visitor method for this variant.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(TokenVisitor<R> visitor);

    /**
     * @return The diagnostic rendering of this token.
     */
    default String pretty() {
        return accept(TokenPrinter.INSTANCE);
    }

    /**
     * An identifier together with the handle interned for its text.
     * @param pos The source position.
     * @param text The identifier as written.
     * @param unique The handle assigned to {@code text} in the current session.
     */
    record Name(SourcePos pos, String text, Unique unique) implements Token {
        public Name {
            Objects.requireNonNull(pos, "pos");
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(unique, "unique");
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    /**
     * The id following {@code builtin}, resolved to a builtin function by the parser.
     * @param pos The source position.
     * @param text The id as written.
     */
    record BuiltinFunctionId(SourcePos pos, String text) implements Token {
        public BuiltinFunctionId {
            Objects.requireNonNull(pos, "pos");
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitBuiltinFunctionId(this);
        }
    }

    /**
     * The name of a builtin type.
     * @param pos The source position.
     * @param text The type name as written.
     */
    record BuiltinTypeId(SourcePos pos, String text) implements Token {
        public BuiltinTypeId {
            Objects.requireNonNull(pos, "pos");
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitBuiltinTypeId(this);
        }
    }

    /**
     * What follows {@code con}: a builtin type name and the shape of the constant's body.
     * @param pos The source position.
     * @param typeName The builtin type name.
     * @param literal The shape of the literal body.
     */
    record ConArgs(SourcePos pos, String typeName, LiteralConst literal) implements Token {
        public ConArgs {
            Objects.requireNonNull(pos, "pos");
            Objects.requireNonNull(typeName, "typeName");
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitConArgs(this);
        }
    }

    /**
     * A reserved word.
     * @param pos The source position.
     * @param keyword The keyword.
     */
    record KeywordToken(SourcePos pos, Keyword keyword) implements Token {
        public KeywordToken {
            Objects.requireNonNull(pos, "pos");
            Objects.requireNonNull(keyword, "keyword");
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitKeyword(this);
        }
    }

    /**
     * A literal-constant body. The body is the raw, uninterpreted source text.
     * @param pos The source position.
     * @param literal The shape of the body.
     * @param body The raw body text with surrounding spaces removed.
     */
    record LiteralConstToken(SourcePos pos, LiteralConst literal, String body) implements Token {
        public LiteralConstToken {
            Objects.requireNonNull(pos, "pos");
            Objects.requireNonNull(literal, "literal");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitLiteralConst(this);
        }
    }

    /**
     * A non-negative integer of arbitrary size, e.g. a program version component.
     * @param pos The source position.
     * @param value The value, never negative.
     */
    record Natural(SourcePos pos, BigInteger value) implements Token {
        public Natural {
            Objects.requireNonNull(pos, "pos");
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("Natural must not be negative: " + value);
            }
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitNatural(this);
        }
    }

    /**
     * Terminates every token stream.
     * @param pos The position just past the last character.
     */
    record EndOfInput(SourcePos pos) implements Token {
        public EndOfInput {
            Objects.requireNonNull(pos, "pos");
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitEndOfInput(this);
        }
    }
}
