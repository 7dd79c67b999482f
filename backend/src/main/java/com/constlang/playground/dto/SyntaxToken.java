package com.constlang.playground.dto;

import com.constlang.playground.lexer.Token;

/**
 * A repaired token as shown to the client. Columns are 1-based and inclusive.
 *
 * @param synthetic {@code true} if the token was inserted or substituted by the repair
 */
public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value,
    boolean synthetic
) {

    public static SyntaxToken of(Token token, boolean synthetic) {
        return new SyntaxToken(
                token.line(),
                token.column(),
                token.line(),
                token.endColumn(),
                token.kind().name(),
                token.text(),
                synthetic);
    }
}
