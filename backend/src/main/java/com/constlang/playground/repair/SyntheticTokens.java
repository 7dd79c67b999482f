package com.constlang.playground.repair;

import com.constlang.playground.lexer.Token;
import com.constlang.playground.lexer.TokenKind;

/**
 * Tokens the repair search makes up when something is missing or has to be replaced.
 */
public final class SyntheticTokens {

    private SyntheticTokens() {
    }

    public static String defaultSpelling(TokenKind kind) {
        return switch (kind) {
            case IDENTIFIER -> "variable_name";
            case NUMBER -> "0";
            default -> kind.literal();
        };
    }

    public static Token create(TokenKind kind, int line, int column) {
        return new Token(kind, defaultSpelling(kind), line, column);
    }

    /** A token of {@code kind} positioned where {@code reference} starts. */
    public static Token at(TokenKind kind, Token reference) {
        return create(kind, reference.line(), reference.column());
    }

    /** A token of {@code kind} positioned just past the end of {@code reference}. */
    public static Token after(TokenKind kind, Token reference) {
        return create(kind, reference.line(), reference.column() + reference.text().length());
    }
}
