package com.constlang.playground.repair;

import com.constlang.playground.lexer.Diagnostic;
import com.constlang.playground.lexer.Token;

import java.util.List;

/**
 * Outcome of one repair run.
 *
 * @param tokens           repaired tokens, or the input unchanged if the budget ran out
 * @param edits            edits in the order they were applied; empty if the budget ran out
 * @param diagnostics      one per edit, or a single budget diagnostic
 * @param budgetExceeded   whether the search gave up
 * @param expandedBranches branches taken off the queue
 */
public record RepairResult(
        List<Token> tokens,
        List<EditOp> edits,
        List<Diagnostic> diagnostics,
        boolean budgetExceeded,
        int expandedBranches) {

    public RepairResult {
        tokens = List.copyOf(tokens);
        edits = List.copyOf(edits);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return !budgetExceeded && edits.isEmpty();
    }
}
