package com.c89.lexer.scanner;

import com.c89.lexer.model.SourcePosition;

/**
 * Read position over an immutable, fully loaded source buffer.
 * <p>
 * Only {@code '\n'} starts a new line; every other character, {@code '\r'} and tabs included,
 * advances the column by one.
 */
public class SourceCursor {

    /** Returned by {@link #peek} past the end of the buffer; cannot occur in ISO-8859-1 input. */
    public static final char EOF = '\uFFFF';

    private final String source;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    public SourceCursor(String source) {
        this.source = source;
    }

    public char peek() {
        return peek(0);
    }

    public char peek(int k) {
        int i = offset + k;
        if (i < 0 || i >= source.length()) {
            return EOF;
        }
        return source.charAt(i);
    }

    /**
     * Consumes one character and returns it. At the end of input nothing moves and {@link #EOF} is returned.
     */
    public char advance() {
        if (isAtEnd()) {
            return EOF;
        }
        char c = source.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    public boolean isAtEnd() {
        return offset >= source.length();
    }

    public SourcePosition mark() {
        return new SourcePosition(offset, line, column);
    }

    public void rewind(SourcePosition mark) {
        if (mark.getOffset() > offset) {
            throw new IllegalArgumentException("Cannot rewind forward from " + mark() + " to " + mark);
        }
        this.offset = mark.getOffset();
        this.line = mark.getLine();
        this.column = mark.getColumn();
    }

    /**
     * Source text from {@code from} up to the current position.
     */
    public String slice(SourcePosition from) {
        return source.substring(from.getOffset(), offset);
    }

    /**
     * True when only blanks separate the current position from the start of its line.
     */
    public boolean isAtLineStart() {
        int i = offset - 1;
        while (i >= 0 && isHorizontalSpace(source.charAt(i))) {
            i--;
        }
        return i < 0 || source.charAt(i) == '\n';
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    static boolean isHorizontalSpace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || c == '\r';
    }
}
