package com.c89.lexer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Value of a floating constant and the type selected by its suffix.
 */
@Value
@Builder
public class FloatingConstantValue implements TokenValue {
    double value;
    @NonNull
    Suffix suffix;

    public enum Suffix {
        /** No suffix, type {@code double}. */
        NONE,
        /** {@code f} or {@code F}. */
        FLOAT,
        /** {@code l} or {@code L}. */
        LONG_DOUBLE
    }
}
