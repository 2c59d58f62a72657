package com.c89.lexer.scanner;

import com.c89.lexer.model.LexerState;

/**
 * One recognizer in the driver's fixed priority list.
 */
public interface TokenMatcher {

    /**
     * Looks at the cursor without consuming anything.
     */
    boolean canStart(SourceCursor cursor);

    /**
     * Consumes the longest lexeme this matcher recognizes. Only called after {@link #canStart}
     * returned true, and always consumes at least one character.
     *
     * @throws LexicalException on an error the scan cannot recover from
     */
    MatchResult match(SourceCursor cursor);

    /**
     * State the driver reports while this matcher runs.
     */
    default LexerState activeState() {
        return LexerState.SCANNING;
    }
}
