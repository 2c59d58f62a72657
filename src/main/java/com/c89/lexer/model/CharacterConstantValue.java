package com.c89.lexer.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Decoded bytes of a character constant. A multi-character constant such as {@code 'ab'}
 * gets its integer value by accumulating bytes big-endian, each taken as unsigned.
 * <p>
 * The value holds at most {@link #MAX_VALUE_BYTES} bytes: for a longer constant only the last
 * ones count, as in {@code 'abcdefghi'} whose value is that of {@code 'bcdefghi'}. All bytes stay
 * available through {@link #getBytes()}.
 */
@EqualsAndHashCode
@ToString
public class CharacterConstantValue implements TokenValue {
    public static final int MAX_VALUE_BYTES = Long.BYTES;

    private final byte[] bytes;
    private final long value;

    public CharacterConstantValue(byte[] bytes) {
        this.bytes = bytes.clone();
        long acc = 0;
        for (int i = Math.max(0, bytes.length - MAX_VALUE_BYTES); i < bytes.length; i++) {
            acc = (acc << 8) | (bytes[i] & 0xFF);
        }
        this.value = acc;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public long getValue() {
        return value;
    }

    public boolean isMultiCharacter() {
        return bytes.length > 1;
    }

    /**
     * Whether leading bytes were left out of {@link #getValue()}.
     */
    public boolean isTruncated() {
        return bytes.length > MAX_VALUE_BYTES;
    }

    public static CharacterConstantValue of(int... values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        return new CharacterConstantValue(bytes);
    }
}
