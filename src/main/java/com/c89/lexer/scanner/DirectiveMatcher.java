package com.c89.lexer.scanner;

import com.c89.lexer.model.LexerState;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.TokenKind;

/**
 * A {@code #} that opens a line, through the end of the line. A backslash immediately before the
 * newline splices the next physical line into the directive. The final newline is left unconsumed.
 */
public class DirectiveMatcher implements TokenMatcher {

    @Override
    public boolean canStart(SourceCursor cursor) {
        return cursor.peek() == '#' && cursor.isAtLineStart();
    }

    @Override
    public MatchResult match(SourceCursor cursor) {
        SourcePosition start = cursor.mark();
        while (!cursor.isAtEnd()) {
            char c = cursor.peek();
            if (c == '\\' && cursor.peek(1) == '\n') {
                cursor.advance(2);
            } else if (c == '\\' && cursor.peek(1) == '\r' && cursor.peek(2) == '\n') {
                cursor.advance(3);
            } else if (c == '\n') {
                break;
            } else {
                cursor.advance();
            }
        }
        return MatchResult.of(TokenKind.PREPROCESSOR_DIRECTIVE, start, cursor.slice(start), null);
    }

    @Override
    public LexerState activeState() {
        return LexerState.IN_DIRECTIVE;
    }
}
