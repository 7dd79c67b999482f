package com.constlang.playground.lexer;

import java.util.List;

public record ScanResult(
        List<Token> tokens,
        List<Diagnostic> diagnostics) {

    public ScanResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }
}
