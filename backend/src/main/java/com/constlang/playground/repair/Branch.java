package com.constlang.playground.repair;

import com.constlang.playground.grammar.GrammarState;
import com.constlang.playground.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A partial repair: the tokens produced so far, how much of the input they account for, and
 * the edits it took.
 *
 * <p>Edits only ever happen at the cursor, so whatever has not been consumed yet is always a
 * suffix of the original input and is never copied.
 *
 * @param cursor   index of the next unconsumed input token
 * @param emitted  output tokens so far
 * @param state    grammar state after {@code emitted}
 * @param log      every edit applied, across all statements
 * @param baseline log size when the last statement was closed by a real terminator
 * @param sequence push order, used to break ties between equally cheap branches
 */
record Branch(
        int cursor,
        ConsList<Token> emitted,
        GrammarState state,
        ConsList<EditOp> log,
        int baseline,
        long sequence) {

    static Branch root() {
        return new Branch(0, ConsList.empty(), GrammarState.START, ConsList.empty(), 0, 0);
    }

    /** Edits spent on the statement currently being built. */
    int editCount() {
        return log.size() - baseline;
    }

    /** Accepts the input token at the cursor as is. */
    Branch consume(Token token, GrammarState next, long seq) {
        if (next == GrammarState.END) {
            return new Branch(cursor + 1, emitted.prepend(token), GrammarState.START,
                    log, log.size(), seq);
        }
        return new Branch(cursor + 1, emitted.prepend(token), next, log, baseline, seq);
    }

    Branch delete(Token token, long seq) {
        EditOp op = new EditOp.Delete(emitted.size(), token);
        return new Branch(cursor + 1, emitted, state, log.prepend(op), baseline, seq);
    }

    Branch replace(Token oldToken, Token newToken, GrammarState next, long seq) {
        EditOp op = new EditOp.Replace(emitted.size(), oldToken, newToken);
        return new Branch(cursor + 1, emitted.prepend(newToken), restart(next),
                log.prepend(op), baseline, seq);
    }

    /** Inserts {@code token} before the cursor; the input token there is looked at again. */
    Branch insert(Token token, GrammarState next, long seq) {
        EditOp op = new EditOp.Insert(emitted.size(), token);
        return new Branch(cursor, emitted.prepend(token), restart(next),
                log.prepend(op), baseline, seq);
    }

    /** Last token produced so far, or {@code null}. */
    Token lastEmitted() {
        return emitted.last();
    }

    List<Token> tokens(List<Token> input) {
        List<Token> tokens = new ArrayList<>(emitted.toList());
        tokens.addAll(input.subList(cursor, input.size()));
        return tokens;
    }

    List<EditOp> edits() {
        return log.toList();
    }

    /**
     * A statement closed by a made-up terminator starts the next one, but its edits keep
     * counting against the budget until a real terminator is consumed.
     */
    private static GrammarState restart(GrammarState next) {
        return next == GrammarState.END ? GrammarState.START : next;
    }
}
