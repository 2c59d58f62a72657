package com.c89.lexer.model;

import java.math.BigInteger;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Value of an integer constant together with its radix and suffix flags.
 * The value is exact; no range check against a target type is made.
 */
@Value
@Builder
public class IntegerConstantValue implements TokenValue {
    @NonNull
    BigInteger value;
    int radix;
    boolean unsignedSuffix;
    boolean longSuffix;
    /** {@code ll}/{@code LL}; accepted as an extension, {@link #longSuffix} is set as well. */
    boolean longLongSuffix;

    public boolean isHexadecimal() {
        return radix == 16;
    }

    public boolean isOctal() {
        return radix == 8;
    }
}
