package com.c89.lexer.model;

/**
 * Closed set of token categories produced by the lexer.
 */
public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    INTEGER_CONSTANT,
    FLOATING_CONSTANT,
    CHARACTER_CONSTANT,
    STRING_LITERAL,
    PUNCTUATOR,
    /** A whole {@code #} line, continuations included, content uninterpreted. */
    PREPROCESSOR_DIRECTIVE,
    /** Only produced when comment retention is enabled. */
    COMMENT,
    /** Raw text of a recoverable lexical error; always paired with a {@link Diagnostic}. */
    INVALID,
    END_OF_FILE
}
