package com.constlang.playground.lexer;

public record Diagnostic(
        int line,
        int column,
        DiagnosticType type,
        String message) {

    public static Diagnostic lexicalError(int line, int column, String message) {
        return new Diagnostic(line, column, DiagnosticType.LEXICAL_ERROR, message);
    }

    public static Diagnostic correction(int line, int column, String message) {
        return new Diagnostic(line, column, DiagnosticType.CORRECTION_NOTICE, message);
    }

    public static Diagnostic repair(Token at, String message) {
        return new Diagnostic(at.line(), at.column(), DiagnosticType.REPAIR, message);
    }

    public static Diagnostic budgetExceeded(int maxEditCount) {
        return new Diagnostic(0, 0, DiagnosticType.BUDGET_EXCEEDED,
                "repair budget exceeded (" + maxEditCount + " edits per statement)");
    }
}
