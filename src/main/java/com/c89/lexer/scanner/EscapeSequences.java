package com.c89.lexer.scanner;

import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Decodes one backslash sequence inside a character constant or string literal.
 */
@UtilityClass
public class EscapeSequences {

    /** The backslash was followed by a newline; the two characters vanish. */
    public static final int LINE_SPLICE = -1;

    /** Unknown escape, or {@code \x} without hex digits. */
    public static final int INVALID = -2;

    private static final Map<Character, Integer> SIMPLE = Map.ofEntries(
            Map.entry('n', (int) '\n'),
            Map.entry('t', (int) '\t'),
            Map.entry('\\', (int) '\\'),
            Map.entry('\'', (int) '\''),
            Map.entry('"', (int) '"'),
            Map.entry('?', (int) '?'),
            Map.entry('a', 0x07),
            Map.entry('b', 0x08),
            Map.entry('f', 0x0C),
            Map.entry('r', (int) '\r'),
            Map.entry('v', 0x0B)
    );

    /**
     * Consumes the sequence starting at the backslash under the cursor and returns the decoded
     * byte (0-255), {@link #LINE_SPLICE} or {@link #INVALID}. Numeric escapes are truncated to
     * 8 bits. When the backslash is the last character of the input only the backslash is consumed.
     */
    public static int decode(SourceCursor cursor) {
        cursor.advance();
        char c = cursor.peek();

        if (c == SourceCursor.EOF) {
            return INVALID;
        }
        if (c == '\n') {
            cursor.advance();
            return LINE_SPLICE;
        }
        if (c == '\r' && cursor.peek(1) == '\n') {
            cursor.advance(2);
            return LINE_SPLICE;
        }

        Integer simple = SIMPLE.get(c);
        if (simple != null) {
            cursor.advance();
            return simple;
        }

        if (CharClasses.isOctalDigit(c)) {
            int value = 0;
            for (int i = 0; i < 3 && CharClasses.isOctalDigit(cursor.peek()); i++) {
                value = value * 8 + (cursor.advance() - '0');
            }
            return value & 0xFF;
        }

        if (c == 'x') {
            cursor.advance();
            if (!CharClasses.isHexDigit(cursor.peek())) {
                return INVALID;
            }
            int value = 0;
            while (CharClasses.isHexDigit(cursor.peek())) {
                value = ((value << 4) | Character.digit(cursor.advance(), 16)) & 0xFFFF;
            }
            return value & 0xFF;
        }

        // an unknown escape never swallows the line end
        if (c != '\r') {
            cursor.advance();
        }
        return INVALID;
    }
}
