package com.constlang.playground.lexer;

public enum DiagnosticType {
    /** A character no token pattern accepts. */
    LEXICAL_ERROR,
    /** The scanner rewrote a token's spelling. */
    CORRECTION_NOTICE,
    /** An edit applied by the repair search. */
    REPAIR,
    /** The repair search ran out of budget; tokens are returned unrepaired. */
    BUDGET_EXCEEDED
}
