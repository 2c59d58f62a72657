package com.c89.lexer.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Fixed table of C89 operators and separators.
 */
@Getter
public enum Punctuator {
    // three characters
    SHIFT_LEFT_ASSIGN("<<=", Category.OPERATOR),
    SHIFT_RIGHT_ASSIGN(">>=", Category.OPERATOR),
    ELLIPSIS("...", Category.DELIMITER),

    // two characters
    ARROW("->", Category.OPERATOR),
    INCREMENT("++", Category.OPERATOR),
    DECREMENT("--", Category.OPERATOR),
    SHIFT_LEFT("<<", Category.OPERATOR),
    SHIFT_RIGHT(">>", Category.OPERATOR),
    LESS_EQUAL("<=", Category.OPERATOR),
    GREATER_EQUAL(">=", Category.OPERATOR),
    EQUAL("==", Category.OPERATOR),
    NOT_EQUAL("!=", Category.OPERATOR),
    LOGICAL_AND("&&", Category.OPERATOR),
    LOGICAL_OR("||", Category.OPERATOR),
    MULTIPLY_ASSIGN("*=", Category.OPERATOR),
    DIVIDE_ASSIGN("/=", Category.OPERATOR),
    MODULO_ASSIGN("%=", Category.OPERATOR),
    ADD_ASSIGN("+=", Category.OPERATOR),
    SUBTRACT_ASSIGN("-=", Category.OPERATOR),
    AND_ASSIGN("&=", Category.OPERATOR),
    XOR_ASSIGN("^=", Category.OPERATOR),
    OR_ASSIGN("|=", Category.OPERATOR),

    // one character
    LEFT_BRACKET("[", Category.DELIMITER),
    RIGHT_BRACKET("]", Category.DELIMITER),
    LEFT_PAREN("(", Category.DELIMITER),
    RIGHT_PAREN(")", Category.DELIMITER),
    LEFT_BRACE("{", Category.DELIMITER),
    RIGHT_BRACE("}", Category.DELIMITER),
    SEMICOLON(";", Category.DELIMITER),
    COMMA(",", Category.DELIMITER),
    COLON(":", Category.DELIMITER),
    DOT(".", Category.OPERATOR),
    AMPERSAND("&", Category.OPERATOR),
    STAR("*", Category.OPERATOR),
    PLUS("+", Category.OPERATOR),
    MINUS("-", Category.OPERATOR),
    TILDE("~", Category.OPERATOR),
    BANG("!", Category.OPERATOR),
    SLASH("/", Category.OPERATOR),
    PERCENT("%", Category.OPERATOR),
    LESS("<", Category.OPERATOR),
    GREATER(">", Category.OPERATOR),
    CARET("^", Category.OPERATOR),
    PIPE("|", Category.OPERATOR),
    QUESTION("?", Category.OPERATOR),
    ASSIGN("=", Category.OPERATOR);

    public static final int MAX_LENGTH = 3;

    private static final Map<String, Punctuator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Punctuator::getSymbol, Function.identity()));

    private static final Set<String> PREFIXES = buildPrefixes();

    private final String symbol;
    private final Category category;

    Punctuator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public static Optional<Punctuator> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    /**
     * True when {@code text} is the start of at least one table entry (entries are their own prefixes).
     */
    public static boolean isPrefix(String text) {
        return PREFIXES.contains(text);
    }

    private static Set<String> buildPrefixes() {
        Set<String> prefixes = new HashSet<>();
        for (Punctuator p : values()) {
            for (int i = 1; i <= p.symbol.length(); i++) {
                prefixes.add(p.symbol.substring(0, i));
            }
        }
        return Set.copyOf(prefixes);
    }

    public enum Category {
        OPERATOR,
        DELIMITER
    }
}
