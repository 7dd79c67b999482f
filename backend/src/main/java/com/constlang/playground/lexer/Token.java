package com.constlang.playground.lexer;

import java.util.Objects;

/**
 * Immutable scanned or synthesized token. Lines and columns are 1-based.
 */
public record Token(
        TokenKind kind,
        String text,
        int line,
        int column) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public int endColumn() {
        return column + text.length() - 1;
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + line + ":" + column;
    }
}
