package com.c89.lexer.config;

import lombok.Builder;
import lombok.Value;

/**
 * Dialect switches for one scan. The defaults describe strict C89 with comments discarded.
 */
@Value
@Builder(toBuilder = true)
public class LexerConfig {

    /** Accept {@code //} line comments; when off, {@code //} is two {@code /} punctuators. */
    boolean allowLineComments;

    /** Emit comments as {@code COMMENT} tokens instead of discarding them. */
    boolean retainComments;

    public static LexerConfig strict() {
        return LexerConfig.builder().build();
    }
}
