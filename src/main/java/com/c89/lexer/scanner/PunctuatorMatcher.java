package com.c89.lexer.scanner;

import com.c89.lexer.model.Punctuator;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.TokenKind;

/**
 * Greedy longest match over {@link Punctuator}. Walks forward while the consumed text is still a
 * prefix of some entry, remembering the last complete entry, then rewinds to it. Lookahead never
 * exceeds {@link Punctuator#MAX_LENGTH} characters.
 */
public class PunctuatorMatcher implements TokenMatcher {

    @Override
    public boolean canStart(SourceCursor cursor) {
        return Punctuator.fromSymbol(String.valueOf(cursor.peek())).isPresent();
    }

    @Override
    public MatchResult match(SourceCursor cursor) {
        SourcePosition start = cursor.mark();
        SourcePosition lastHit = null;
        StringBuilder text = new StringBuilder(Punctuator.MAX_LENGTH);

        while (text.length() < Punctuator.MAX_LENGTH && !cursor.isAtEnd()) {
            text.append(cursor.peek());
            if (!Punctuator.isPrefix(text.toString())) {
                break;
            }
            cursor.advance();
            if (Punctuator.fromSymbol(text.toString()).isPresent()) {
                lastHit = cursor.mark();
            }
        }

        if (lastHit == null) {
            throw new IllegalStateException("No punctuator at " + start);
        }
        cursor.rewind(lastHit);
        return MatchResult.of(TokenKind.PUNCTUATOR, start, cursor.slice(start), null);
    }
}
