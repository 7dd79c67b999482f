package com.constlang.playground.lexer;

/**
 * Token kinds of the declaration language.
 *
 * <p>Declaration order doubles as scanner priority for the fixed-spelling kinds and as the
 * tie-break order used when the repair search enumerates candidate kinds.
 */
public enum TokenKind {
    CONST("const", true),
    I32("i32", true),
    COLON(":", false),
    ASSIGN("=", false),
    PLUS("+", false),
    MINUS("-", false),
    SEMICOLON(";", false),
    IDENTIFIER(null, false),
    NUMBER(null, false);

    private final String literal;
    private final boolean keyword;

    TokenKind(String literal, boolean keyword) {
        this.literal = literal;
        this.keyword = keyword;
    }

    /**
     * Fixed spelling of this kind, or {@code null} for identifiers and numbers.
     */
    public String literal() {
        return literal;
    }

    public boolean isKeyword() {
        return keyword;
    }
}
