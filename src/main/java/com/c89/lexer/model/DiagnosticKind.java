package com.c89.lexer.model;

import lombok.Getter;

/**
 * Lexical error categories. Only {@link #UNTERMINATED_COMMENT} stops a scan.
 */
@Getter
public enum DiagnosticKind {
    INVALID_NUMERIC_CONSTANT(false),
    UNTERMINATED_CHARACTER_CONSTANT(false),
    EMPTY_CHARACTER_CONSTANT(false),
    UNTERMINATED_STRING_LITERAL(false),
    INVALID_ESCAPE_SEQUENCE(false),
    UNKNOWN_CHARACTER(false),
    UNTERMINATED_COMMENT(true);

    private final boolean fatal;

    DiagnosticKind(boolean fatal) {
        this.fatal = fatal;
    }
}
