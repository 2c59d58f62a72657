package com.c89.lexer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A lexical error reported at the position of the first character of the offending text.
 */
@Value
@Builder
public class Diagnostic {
    @NonNull
    DiagnosticKind kind;
    @NonNull
    String lexeme;
    int line;
    int column;
    @NonNull
    String message;

    public boolean isFatal() {
        return kind.isFatal();
    }

    /**
     * Compiler-style rendering, e.g. {@code 3:7: error: unterminated string literal}.
     */
    public String format() {
        return line + ":" + column + ": " + (isFatal() ? "fatal error" : "error") + ": " + message;
    }
}
