package com.constlang.playground.grammar;

/**
 * States of the declaration automaton, named after what is expected next.
 */
public enum GrammarState {
    START,
    CONSTIDENTIFIER,
    COLON,
    DATATYPE,
    ASSIGNMENT,
    VALUE,
    WHOLENUMBER,
    SEMICOLON,
    END
}
