package com.constlang.playground.repair;

import com.constlang.playground.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * One edit applied to the token stream during repair.
 *
 * <p>{@code position} is the index in the working sequence at the moment the edit was made,
 * so undoing a log newest-first restores the sequence it started from.
 */
public sealed interface EditOp permits EditOp.Insert, EditOp.Delete, EditOp.Replace {

    int position();

    /**
     * Reverts this edit on {@code tokens}, which must be in the state right after it was applied.
     */
    void undo(List<Token> tokens);

    /**
     * Rebuilds the sequence a repair started from out of its result and edit log.
     */
    static List<Token> revert(List<Token> repaired, List<EditOp> edits) {
        List<Token> tokens = new ArrayList<>(repaired);
        for (int i = edits.size() - 1; i >= 0; i--) {
            edits.get(i).undo(tokens);
        }
        return tokens;
    }

    record Insert(int position, Token token) implements EditOp {
        @Override
        public void undo(List<Token> tokens) {
            tokens.remove(position);
        }
    }

    record Delete(int position, Token token) implements EditOp {
        @Override
        public void undo(List<Token> tokens) {
            tokens.add(position, token);
        }
    }

    record Replace(int position, Token oldToken, Token newToken) implements EditOp {
        @Override
        public void undo(List<Token> tokens) {
            tokens.set(position, oldToken);
        }
    }
}
