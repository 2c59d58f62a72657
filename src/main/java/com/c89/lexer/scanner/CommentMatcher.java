package com.c89.lexer.scanner;

import com.c89.lexer.config.LexerConfig;
import com.c89.lexer.model.Diagnostic;
import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.TokenKind;

/**
 * Block comments and, when enabled, line comments. Block comments do not nest.
 */
public class CommentMatcher implements TokenMatcher {

    private final boolean allowLineComments;

    public CommentMatcher(LexerConfig config) {
        this.allowLineComments = config.isAllowLineComments();
    }

    @Override
    public boolean canStart(SourceCursor cursor) {
        if (cursor.peek() != '/') {
            return false;
        }
        char next = cursor.peek(1);
        return next == '*' || (next == '/' && allowLineComments);
    }

    @Override
    public MatchResult match(SourceCursor cursor) {
        SourcePosition start = cursor.mark();
        if (cursor.peek(1) == '*') {
            return blockComment(cursor, start);
        }
        while (!cursor.isAtEnd() && cursor.peek() != '\n') {
            cursor.advance();
        }
        return MatchResult.of(TokenKind.COMMENT, start, cursor.slice(start), null);
    }

    private MatchResult blockComment(SourceCursor cursor, SourcePosition start) {
        cursor.advance(2);
        while (!cursor.isAtEnd()) {
            if (cursor.peek() == '*' && cursor.peek(1) == '/') {
                cursor.advance(2);
                return MatchResult.of(TokenKind.COMMENT, start, cursor.slice(start), null);
            }
            cursor.advance();
        }
        throw new LexicalException(Diagnostic.builder()
                .kind(DiagnosticKind.UNTERMINATED_COMMENT)
                .lexeme(cursor.slice(start))
                .line(start.getLine())
                .column(start.getColumn())
                .message("unterminated comment")
                .build());
    }
}
