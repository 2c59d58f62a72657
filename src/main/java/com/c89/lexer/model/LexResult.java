package com.c89.lexer.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one complete scan.
 */
@Value
@Builder
public class LexResult {
    @Singular
    List<Token> tokens;
    @Singular
    List<Diagnostic> diagnostics;
    @NonNull
    LexerState state;

    public boolean isFatal() {
        return state == LexerState.FATAL;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public Optional<Diagnostic> fatalDiagnostic() {
        return diagnostics.stream().filter(Diagnostic::isFatal).findFirst();
    }

    /**
     * Tokens without the trailing {@link TokenKind#END_OF_FILE}.
     */
    public List<Token> significantTokens() {
        return tokens.stream().filter(t -> !t.is(TokenKind.END_OF_FILE)).toList();
    }
}
