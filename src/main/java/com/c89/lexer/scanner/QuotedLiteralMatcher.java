package com.c89.lexer.scanner;

import java.io.ByteArrayOutputStream;

import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.TokenKind;
import com.c89.lexer.model.TokenValue;

/**
 * Shared scanning for quote-delimited literals. A literal may not contain a raw newline; scanning
 * stops before it (or at end of input) and reports the literal as unterminated. An invalid escape
 * is reported once, after the literal has been read through its closing quote.
 */
public abstract class QuotedLiteralMatcher implements TokenMatcher {

    private final char quote;
    private final TokenKind kind;
    private final DiagnosticKind unterminatedKind;
    private final String description;

    protected QuotedLiteralMatcher(char quote, TokenKind kind, DiagnosticKind unterminatedKind, String description) {
        this.quote = quote;
        this.kind = kind;
        this.unterminatedKind = unterminatedKind;
        this.description = description;
    }

    @Override
    public boolean canStart(SourceCursor cursor) {
        return cursor.peek() == quote;
    }

    @Override
    public MatchResult match(SourceCursor cursor) {
        SourcePosition start = cursor.mark();
        cursor.advance();

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        String escapeError = null;

        while (true) {
            char c = cursor.peek();
            if (c == SourceCursor.EOF || c == '\n') {
                return MatchResult.error(unterminatedKind, start, cursor.slice(start),
                        "missing terminating " + quote + " character in " + description);
            }
            if (c == quote) {
                cursor.advance();
                break;
            }
            if (c == '\\') {
                SourcePosition escapeStart = cursor.mark();
                int decoded = EscapeSequences.decode(cursor);
                if (decoded == EscapeSequences.INVALID) {
                    if (escapeError == null) {
                        escapeError = "unknown escape sequence '" + cursor.slice(escapeStart) + "' in " + description;
                    }
                } else if (decoded != EscapeSequences.LINE_SPLICE) {
                    bytes.write(decoded);
                }
                continue;
            }
            bytes.write(c <= 0xFF ? c : '?');
            cursor.advance();
        }

        String lexeme = cursor.slice(start);
        if (escapeError != null) {
            return MatchResult.error(DiagnosticKind.INVALID_ESCAPE_SEQUENCE, start, lexeme, escapeError);
        }
        return complete(start, lexeme, bytes.toByteArray());
    }

    /**
     * Builds the result for a closed literal without escape errors.
     */
    protected MatchResult complete(SourcePosition start, String lexeme, byte[] decoded) {
        return MatchResult.of(kind, start, lexeme, createValue(decoded));
    }

    protected abstract TokenValue createValue(byte[] decoded);
}
