package com.c89.lexer.scanner;

import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.StringLiteralValue;
import com.c89.lexer.model.TokenKind;
import com.c89.lexer.model.TokenValue;

public class StringLiteralMatcher extends QuotedLiteralMatcher {

    public StringLiteralMatcher() {
        super('"', TokenKind.STRING_LITERAL, DiagnosticKind.UNTERMINATED_STRING_LITERAL, "string literal");
    }

    @Override
    protected TokenValue createValue(byte[] decoded) {
        return new StringLiteralValue(decoded);
    }
}
