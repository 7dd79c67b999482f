package com.constlang.playground.dto;

import com.constlang.playground.lexer.Diagnostic;

public record SyntaxDiagnostic(
        int line,
        int column,
        String type,
        String message) {

    public static SyntaxDiagnostic of(Diagnostic diagnostic) {
        return new SyntaxDiagnostic(
                diagnostic.line(),
                diagnostic.column(),
                diagnostic.type().name(),
                diagnostic.message());
    }
}
