package com.c89.lexer.model;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A lexical token. {@code lexeme} is the exact source text consumed; {@code offset}, {@code line}
 * and {@code column} locate its first character.
 */
@Value
@Builder
public class Token {
    @NonNull
    TokenKind kind;
    @NonNull
    String lexeme;
    int offset;
    int line;
    int column;
    TokenValue value;

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public int getEndOffset() {
        return offset + lexeme.length();
    }

    public SourcePosition getPosition() {
        return new SourcePosition(offset, line, column);
    }

    public Optional<TokenValue> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Typed access to the payload; fails when the token carries a different value type.
     */
    public <T extends TokenValue> T valueAs(Class<T> type) {
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Token " + kind + " '" + lexeme + "' has no " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public Optional<Keyword> keyword() {
        return kind == TokenKind.KEYWORD ? Keyword.fromText(lexeme) : Optional.empty();
    }

    public Optional<Punctuator> punctuator() {
        return kind == TokenKind.PUNCTUATOR ? Punctuator.fromSymbol(lexeme) : Optional.empty();
    }

    @Override
    public String toString() {
        return kind + "(" + lexeme + ")@" + line + ":" + column;
    }
}
