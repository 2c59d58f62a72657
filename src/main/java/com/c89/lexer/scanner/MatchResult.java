package com.c89.lexer.scanner;

import com.c89.lexer.model.Diagnostic;
import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.Token;
import com.c89.lexer.model.TokenKind;
import com.c89.lexer.model.TokenValue;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * What a matcher consumed. A result with an error kind becomes an {@link TokenKind#INVALID} token
 * plus a diagnostic.
 */
@Value
@Builder
public class MatchResult {
    @NonNull
    TokenKind kind;
    @NonNull
    SourcePosition start;
    @NonNull
    String lexeme;
    TokenValue value;
    DiagnosticKind errorKind;
    String errorMessage;

    public static MatchResult of(TokenKind kind, SourcePosition start, String lexeme, TokenValue value) {
        return MatchResult.builder()
                .kind(kind)
                .start(start)
                .lexeme(lexeme)
                .value(value)
                .build();
    }

    public static MatchResult error(DiagnosticKind errorKind, SourcePosition start, String lexeme, String message) {
        return MatchResult.builder()
                .kind(TokenKind.INVALID)
                .start(start)
                .lexeme(lexeme)
                .errorKind(errorKind)
                .errorMessage(message)
                .build();
    }

    public boolean isError() {
        return errorKind != null;
    }

    public Token toToken() {
        return Token.builder()
                .kind(kind)
                .lexeme(lexeme)
                .offset(start.getOffset())
                .line(start.getLine())
                .column(start.getColumn())
                .value(value)
                .build();
    }

    public Diagnostic toDiagnostic() {
        if (!isError()) {
            throw new IllegalStateException("Match of " + kind + " at " + start + " is not an error");
        }
        return Diagnostic.builder()
                .kind(errorKind)
                .lexeme(lexeme)
                .line(start.getLine())
                .column(start.getColumn())
                .message(errorMessage)
                .build();
    }
}
