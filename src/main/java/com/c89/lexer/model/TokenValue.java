package com.c89.lexer.model;

/**
 * Normalized payload attached to constant and literal tokens.
 */
public interface TokenValue {
}
