package com.c89.lexer.model;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Decoded bytes of a string literal, without the terminating NUL the compiler appends.
 */
@EqualsAndHashCode
@ToString
public class StringLiteralValue implements TokenValue {
    private final byte[] bytes;

    public StringLiteralValue(byte[] bytes) {
        this.bytes = bytes.clone();
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Decodes the bytes one-to-one as ISO-8859-1.
     */
    public String asText() {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }
}
