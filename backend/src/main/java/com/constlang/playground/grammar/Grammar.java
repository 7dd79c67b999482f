package com.constlang.playground.grammar;

import com.constlang.playground.exception.GrammarConsistencyException;
import com.constlang.playground.lexer.TokenKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable finite-state transition table over token kinds.
 */
public final class Grammar {

    private final Map<GrammarState, Map<TokenKind, GrammarState>> transitions;

    public Grammar(Map<GrammarState, Map<TokenKind, GrammarState>> transitions) {
        EnumMap<GrammarState, Map<TokenKind, GrammarState>> table = new EnumMap<>(GrammarState.class);
        for (GrammarState state : GrammarState.values()) {
            Map<TokenKind, GrammarState> edges = transitions.get(state);
            if (edges == null) {
                throw new GrammarConsistencyException("No transitions defined for state " + state);
            }
            for (Map.Entry<TokenKind, GrammarState> edge : edges.entrySet()) {
                if (edge.getValue() == null) {
                    throw new GrammarConsistencyException(
                            "Transition " + state + " --" + edge.getKey() + "--> has no target");
                }
            }
            EnumMap<TokenKind, GrammarState> copy = new EnumMap<>(TokenKind.class);
            copy.putAll(edges);
            table.put(state, Collections.unmodifiableMap(copy));
        }
        if (!table.get(GrammarState.END).isEmpty()) {
            throw new GrammarConsistencyException("END must not have outgoing transitions");
        }
        this.transitions = Collections.unmodifiableMap(table);
    }

    /**
     * The grammar {@code const IDENTIFIER : i32 = [-]NUMBER ;}, repeated.
     */
    public static Grammar constDeclaration() {
        Map<GrammarState, Map<TokenKind, GrammarState>> table = new EnumMap<>(GrammarState.class);
        table.put(GrammarState.START, Map.of(TokenKind.CONST, GrammarState.CONSTIDENTIFIER));
        table.put(GrammarState.CONSTIDENTIFIER, Map.of(TokenKind.IDENTIFIER, GrammarState.COLON));
        table.put(GrammarState.COLON, Map.of(TokenKind.COLON, GrammarState.DATATYPE));
        table.put(GrammarState.DATATYPE, Map.of(TokenKind.I32, GrammarState.ASSIGNMENT));
        table.put(GrammarState.ASSIGNMENT, Map.of(TokenKind.ASSIGN, GrammarState.VALUE));
        table.put(GrammarState.VALUE, Map.of(
                TokenKind.NUMBER, GrammarState.SEMICOLON,
                TokenKind.MINUS, GrammarState.WHOLENUMBER));
        table.put(GrammarState.WHOLENUMBER, Map.of(TokenKind.NUMBER, GrammarState.SEMICOLON));
        table.put(GrammarState.SEMICOLON, Map.of(TokenKind.SEMICOLON, GrammarState.END));
        table.put(GrammarState.END, Map.of());
        return new Grammar(table);
    }

    /**
     * Kinds with an outgoing edge from {@code state}, iterated in {@link TokenKind} order.
     */
    public Set<TokenKind> allowedKinds(GrammarState state) {
        return transitions.get(state).keySet();
    }

    public boolean allows(GrammarState state, TokenKind kind) {
        return transitions.get(state).containsKey(kind);
    }

    public GrammarState next(GrammarState state, TokenKind kind) {
        GrammarState target = transitions.get(state).get(kind);
        if (target == null) {
            throw new GrammarConsistencyException(kind + " is not allowed in state " + state);
        }
        return target;
    }

    public boolean isAccepting(GrammarState state) {
        return state == GrammarState.START || state == GrammarState.END;
    }
}
