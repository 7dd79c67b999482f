package com.constlang.playground.exception;

/**
 * Thrown when the transition table is malformed or queried for an edge it does not have.
 * Always a programming error, never a consequence of user input.
 */
public class GrammarConsistencyException extends RuntimeException {

    public GrammarConsistencyException(String message) {
        super(message);
    }
}
