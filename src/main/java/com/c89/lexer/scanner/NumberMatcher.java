package com.c89.lexer.scanner;

import java.math.BigInteger;

import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.FloatingConstantValue;
import com.c89.lexer.model.IntegerConstantValue;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.TokenKind;

/**
 * Integer and floating constants.
 * <p>
 * After the digits, any run of identifier characters is read as the suffix. A suffix that is not
 * a valid C89 suffix for the constant's type turns the whole run into an invalid constant, so the
 * scan resumes after it rather than producing an identifier glued to a number. An octal constant
 * containing {@code 8} or {@code 9} is invalid, and so is an exponent marker with no digits after
 * it, as in {@code 1e+x}.
 */
public class NumberMatcher implements TokenMatcher {

    @Override
    public boolean canStart(SourceCursor cursor) {
        char c = cursor.peek();
        return CharClasses.isDigit(c) || (c == '.' && CharClasses.isDigit(cursor.peek(1)));
    }

    @Override
    public MatchResult match(SourceCursor cursor) {
        SourcePosition start = cursor.mark();

        if (cursor.peek() == '0' && (cursor.peek(1) == 'x' || cursor.peek(1) == 'X')) {
            return hexadecimal(cursor, start);
        }

        String digits = consumeDigits(cursor);
        boolean floating = false;

        if (cursor.peek() == '.') {
            cursor.advance();
            consumeDigits(cursor);
            floating = true;
        }
        Exponent exponent = consumeExponent(cursor);
        if (exponent == Exponent.PRESENT) {
            floating = true;
        }
        if (exponent == Exponent.EMPTY) {
            consumeSuffix(cursor);
            return invalid(cursor, start, "exponent has no digits");
        }

        if (floating || cursor.peek() == 'f' || cursor.peek() == 'F') {
            return floatingConstant(cursor, start);
        }

        int radix = digits.length() > 1 && digits.charAt(0) == '0' ? 8 : 10;
        String suffix = consumeSuffix(cursor);
        if (radix == 8 && !isOctal(digits)) {
            return invalid(cursor, start, "invalid digit in octal constant");
        }
        return integerConstant(cursor, start, digits, radix, suffix);
    }

    private MatchResult hexadecimal(SourceCursor cursor, SourcePosition start) {
        cursor.advance(2);
        StringBuilder digits = new StringBuilder();
        while (CharClasses.isHexDigit(cursor.peek())) {
            digits.append(cursor.advance());
        }
        String suffix = consumeSuffix(cursor);
        if (digits.length() == 0) {
            return invalid(cursor, start, "hexadecimal constant has no digits");
        }
        return integerConstant(cursor, start, digits.toString(), 16, suffix);
    }

    private MatchResult integerConstant(SourceCursor cursor, SourcePosition start, String digits, int radix,
            String suffix) {
        IntegerSuffix parsed = IntegerSuffix.parse(suffix);
        if (parsed == null) {
            return invalid(cursor, start, "invalid suffix \"" + suffix + "\" on integer constant");
        }
        IntegerConstantValue value = IntegerConstantValue.builder()
                .value(new BigInteger(digits, radix))
                .radix(radix)
                .unsignedSuffix(parsed.unsigned)
                .longSuffix(parsed.longCount > 0)
                .longLongSuffix(parsed.longCount == 2)
                .build();
        return MatchResult.of(TokenKind.INTEGER_CONSTANT, start, cursor.slice(start), value);
    }

    private MatchResult floatingConstant(SourceCursor cursor, SourcePosition start) {
        String mantissa = cursor.slice(start);
        String suffix = consumeSuffix(cursor);

        FloatingConstantValue.Suffix kind = switch (suffix) {
            case "" -> FloatingConstantValue.Suffix.NONE;
            case "f", "F" -> FloatingConstantValue.Suffix.FLOAT;
            case "l", "L" -> FloatingConstantValue.Suffix.LONG_DOUBLE;
            default -> null;
        };
        if (kind == null) {
            return invalid(cursor, start, "invalid suffix \"" + suffix + "\" on floating constant");
        }

        FloatingConstantValue value = FloatingConstantValue.builder()
                .value(Double.parseDouble(mantissa))
                .suffix(kind)
                .build();
        return MatchResult.of(TokenKind.FLOATING_CONSTANT, start, cursor.slice(start), value);
    }

    private enum Exponent {
        ABSENT,
        PRESENT,
        EMPTY
    }

    /**
     * Consumes {@code e[+-]digits}. Without digits after the marker the cursor is rewound,
     * nothing is consumed and {@link Exponent#EMPTY} is returned.
     */
    private static Exponent consumeExponent(SourceCursor cursor) {
        if (cursor.peek() != 'e' && cursor.peek() != 'E') {
            return Exponent.ABSENT;
        }
        SourcePosition mark = cursor.mark();
        cursor.advance();
        if (cursor.peek() == '+' || cursor.peek() == '-') {
            cursor.advance();
        }
        if (!CharClasses.isDigit(cursor.peek())) {
            cursor.rewind(mark);
            return Exponent.EMPTY;
        }
        consumeDigits(cursor);
        return Exponent.PRESENT;
    }

    private static String consumeDigits(SourceCursor cursor) {
        StringBuilder sb = new StringBuilder();
        while (CharClasses.isDigit(cursor.peek())) {
            sb.append(cursor.advance());
        }
        return sb.toString();
    }

    private static String consumeSuffix(SourceCursor cursor) {
        StringBuilder sb = new StringBuilder();
        while (CharClasses.isIdentifierPart(cursor.peek())) {
            sb.append(cursor.advance());
        }
        return sb.toString();
    }

    private static boolean isOctal(String digits) {
        for (int i = 0; i < digits.length(); i++) {
            if (!CharClasses.isOctalDigit(digits.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static MatchResult invalid(SourceCursor cursor, SourcePosition start, String message) {
        return MatchResult.error(DiagnosticKind.INVALID_NUMERIC_CONSTANT, start, cursor.slice(start), message);
    }

    /**
     * At most one {@code u}/{@code U} and one of {@code l}, {@code L}, {@code ll}, {@code LL}, in either order.
     */
    private static final class IntegerSuffix {
        private boolean unsigned;
        private int longCount;

        static IntegerSuffix parse(String text) {
            IntegerSuffix suffix = new IntegerSuffix();
            int i = 0;
            while (i < text.length()) {
                char c = text.charAt(i);
                if ((c == 'u' || c == 'U') && !suffix.unsigned) {
                    suffix.unsigned = true;
                    i++;
                } else if ((c == 'l' || c == 'L') && suffix.longCount == 0) {
                    suffix.longCount = 1;
                    i++;
                    if (i < text.length() && text.charAt(i) == c) {
                        suffix.longCount = 2;
                        i++;
                    }
                } else {
                    return null;
                }
            }
            return suffix;
        }
    }
}
