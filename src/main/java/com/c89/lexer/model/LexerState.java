package com.c89.lexer.model;

/**
 * Driver states. {@link #DONE} and {@link #FATAL} are terminal.
 * <p>
 * {@link #IN_DIRECTIVE} is held only while one {@code nextToken()} call consumes a directive line
 * and its continuations; the driver is back in {@link #SCANNING} by the time the directive token
 * is returned. Transitions are logged at debug level.
 */
public enum LexerState {
    SCANNING,
    IN_DIRECTIVE,
    DONE,
    FATAL;

    public boolean isTerminal() {
        return this == DONE || this == FATAL;
    }
}
