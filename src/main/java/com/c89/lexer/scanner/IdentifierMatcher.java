package com.c89.lexer.scanner;

import com.c89.lexer.model.Keyword;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.TokenKind;

public class IdentifierMatcher implements TokenMatcher {

    @Override
    public boolean canStart(SourceCursor cursor) {
        return CharClasses.isIdentifierStart(cursor.peek());
    }

    @Override
    public MatchResult match(SourceCursor cursor) {
        SourcePosition start = cursor.mark();
        cursor.advance();
        while (CharClasses.isIdentifierPart(cursor.peek())) {
            cursor.advance();
        }
        String text = cursor.slice(start);
        TokenKind kind = Keyword.isKeyword(text) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
        return MatchResult.of(kind, start, text, null);
    }
}
