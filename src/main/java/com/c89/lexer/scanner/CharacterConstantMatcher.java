package com.c89.lexer.scanner;

import com.c89.lexer.model.CharacterConstantValue;
import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.TokenKind;
import com.c89.lexer.model.TokenValue;

public class CharacterConstantMatcher extends QuotedLiteralMatcher {

    public CharacterConstantMatcher() {
        super('\'', TokenKind.CHARACTER_CONSTANT, DiagnosticKind.UNTERMINATED_CHARACTER_CONSTANT,
                "character constant");
    }

    @Override
    protected MatchResult complete(SourcePosition start, String lexeme, byte[] decoded) {
        if (decoded.length == 0) {
            return MatchResult.error(DiagnosticKind.EMPTY_CHARACTER_CONSTANT, start, lexeme,
                    "empty character constant");
        }
        return super.complete(start, lexeme, decoded);
    }

    @Override
    protected TokenValue createValue(byte[] decoded) {
        return new CharacterConstantValue(decoded);
    }
}
