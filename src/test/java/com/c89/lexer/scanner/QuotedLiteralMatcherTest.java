package com.c89.lexer.scanner;

import com.c89.lexer.model.CharacterConstantValue;
import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.StringLiteralValue;
import com.c89.lexer.model.TokenKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for character constants, string literals and their escape sequences.
 */
class QuotedLiteralMatcherTest {

    private final CharacterConstantMatcher charMatcher = new CharacterConstantMatcher();
    private final StringLiteralMatcher stringMatcher = new StringLiteralMatcher();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
        "'a'      | 97",
        "'\\n'    | 10",
        "'\\t'    | 9",
        "'\\\\'   | 92",
        "'\\''    | 39",
        "'\\\"'   | 34",
        "'\\?'    | 63",
        "'\\0'    | 0",
        "'\\a'    | 7",
        "'\\b'    | 8",
        "'\\f'    | 12",
        "'\\r'    | 13",
        "'\\v'    | 11",
        "'\\101'  | 65",
        "'\\x41'  | 65",
        "'\\x7f'  | 127",
        "'\\377'  | 255",
        "'\\777'  | 255",
        "'\\x141' | 65"
    })
    void testSingleCharacterValues(String literal, long expected) {
        MatchResult result = charMatcher.match(new SourceCursor(literal));

        assertThat(result.getKind()).isEqualTo(TokenKind.CHARACTER_CONSTANT);
        assertThat(result.getLexeme()).isEqualTo(literal);
        assertThat(((CharacterConstantValue) result.getValue()).getValue()).isEqualTo(expected);
    }

    @Test
    void testOctalEscapeStopsAfterThreeDigits() {
        MatchResult result = charMatcher.match(new SourceCursor("'\\1234'"));
        CharacterConstantValue value = (CharacterConstantValue) result.getValue();

        assertThat(value.getBytes()).containsExactly((byte) 0123, (byte) '4');
        assertThat(value.isMultiCharacter()).isTrue();
        assertThat(value.getValue()).isEqualTo((0123 << 8) | '4');
    }

    @Test
    void testMultiCharacterConstant() {
        CharacterConstantValue value = (CharacterConstantValue) charMatcher.match(new SourceCursor("'ab'")).getValue();

        assertThat(value).isEqualTo(CharacterConstantValue.of('a', 'b'));
        assertThat(value.getValue()).isEqualTo(('a' << 8) | 'b');
    }

    @Test
    void testLongConstantKeepsLastEightBytesInValue() {
        CharacterConstantValue value =
                (CharacterConstantValue) charMatcher.match(new SourceCursor("'abcdefghi'")).getValue();

        assertThat(value.getBytes()).hasSize(9);
        assertThat(value.isTruncated()).isTrue();
        assertThat(value.getValue()).isEqualTo(0x6263646566676869L);
    }

    @Test
    void testEightByteConstantIsNotTruncated() {
        CharacterConstantValue value =
                (CharacterConstantValue) charMatcher.match(new SourceCursor("'\\377bcdefgh'")).getValue();

        assertThat(value.isTruncated()).isFalse();
        assertThat(value.getValue()).isEqualTo(0xFF62636465666768L);
    }

    @Test
    void testEmptyCharacterConstant() {
        MatchResult result = charMatcher.match(new SourceCursor("''"));

        assertThat(result.getKind()).isEqualTo(TokenKind.INVALID);
        assertThat(result.getErrorKind()).isEqualTo(DiagnosticKind.EMPTY_CHARACTER_CONSTANT);
        assertThat(result.getLexeme()).isEqualTo("''");
    }

    @Test
    void testUnterminatedCharacterConstantStopsAtNewline() {
        SourceCursor cursor = new SourceCursor("'a\nb");
        MatchResult result = charMatcher.match(cursor);

        assertThat(result.getErrorKind()).isEqualTo(DiagnosticKind.UNTERMINATED_CHARACTER_CONSTANT);
        assertThat(result.getLexeme()).isEqualTo("'a");
        assertThat(cursor.peek()).isEqualTo('\n');
    }

    @Test
    void testUnknownEscapeIsReportedAfterClosingQuote() {
        SourceCursor cursor = new SourceCursor("'\\q' x");
        MatchResult result = charMatcher.match(cursor);

        assertThat(result.getErrorKind()).isEqualTo(DiagnosticKind.INVALID_ESCAPE_SEQUENCE);
        assertThat(result.getLexeme()).isEqualTo("'\\q'");
        assertThat(result.getErrorMessage()).contains("\\q");
        assertThat(cursor.peek()).isEqualTo(' ');
    }

    @Test
    void testHexEscapeWithoutDigits() {
        MatchResult result = charMatcher.match(new SourceCursor("'\\x'"));

        assertThat(result.getErrorKind()).isEqualTo(DiagnosticKind.INVALID_ESCAPE_SEQUENCE);
        assertThat(result.getLexeme()).isEqualTo("'\\x'");
    }

    @Test
    void testBackslashAtEndOfInputIsUnterminated() {
        MatchResult result = stringMatcher.match(new SourceCursor("\"ab\\"));

        assertThat(result.getErrorKind()).isEqualTo(DiagnosticKind.UNTERMINATED_STRING_LITERAL);
        assertThat(result.getLexeme()).isEqualTo("\"ab\\");
    }

    @Test
    void testStringDecodesEscapes() {
        MatchResult result = stringMatcher.match(new SourceCursor("\"hello\\tworld\\n\""));
        StringLiteralValue value = (StringLiteralValue) result.getValue();

        assertThat(result.getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(value.asText()).isEqualTo("hello\tworld\n");
        assertThat(value.length()).isEqualTo(12);
    }

    @Test
    void testEscapedQuoteDoesNotCloseString() {
        SourceCursor cursor = new SourceCursor("\"a\\\"b\";");
        MatchResult result = stringMatcher.match(cursor);

        assertThat(result.getLexeme()).isEqualTo("\"a\\\"b\"");
        assertThat(((StringLiteralValue) result.getValue()).asText()).isEqualTo("a\"b");
        assertThat(cursor.peek()).isEqualTo(';');
    }

    @Test
    void testSingleQuoteInsideStringIsPlainCharacter() {
        MatchResult result = stringMatcher.match(new SourceCursor("\"it's\""));

        assertThat(((StringLiteralValue) result.getValue()).asText()).isEqualTo("it's");
    }

    @Test
    void testBackslashNewlineSplicesString() {
        SourceCursor cursor = new SourceCursor("\"line1\\\nline2\"");
        MatchResult result = stringMatcher.match(cursor);

        assertThat(result.getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(((StringLiteralValue) result.getValue()).asText()).isEqualTo("line1line2");
        assertThat(cursor.getLine()).isEqualTo(2);
    }

    @Test
    void testEmptyStringIsValid() {
        MatchResult result = stringMatcher.match(new SourceCursor("\"\""));

        assertThat(result.isError()).isFalse();
        assertThat(((StringLiteralValue) result.getValue()).length()).isZero();
    }

    @Test
    void testUnterminatedStringStopsAtNewline() {
        SourceCursor cursor = new SourceCursor("\"abc\n\"");
        MatchResult result = stringMatcher.match(cursor);

        assertThat(result.getErrorKind()).isEqualTo(DiagnosticKind.UNTERMINATED_STRING_LITERAL);
        assertThat(result.getLexeme()).isEqualTo("\"abc");
        assertThat(result.getErrorMessage()).contains("string literal");
    }

    @Test
    void testLatinOneBytesArePreserved() {
        MatchResult result = stringMatcher.match(new SourceCursor("\"café\""));

        assertThat(((StringLiteralValue) result.getValue()).getBytes())
                .containsExactly(new byte[] {'c', 'a', 'f', (byte) 0xE9});
    }
}
