package com.c89.lexer.model;

import lombok.Value;

/**
 * Offset (0-based) plus line and column (both 1-based) of a character in the source buffer.
 */
@Value
public class SourcePosition {
    int offset;
    int line;
    int column;

    public boolean isBefore(SourcePosition other) {
        return line < other.line || (line == other.line && column < other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
