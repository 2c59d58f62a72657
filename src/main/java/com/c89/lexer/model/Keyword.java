package com.c89.lexer.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * The 32 reserved words of C89.
 */
@Getter
public enum Keyword {
    AUTO("auto"),
    BREAK("break"),
    CASE("case"),
    CHAR("char"),
    CONST("const"),
    CONTINUE("continue"),
    DEFAULT("default"),
    DO("do"),
    DOUBLE("double"),
    ELSE("else"),
    ENUM("enum"),
    EXTERN("extern"),
    FLOAT("float"),
    FOR("for"),
    GOTO("goto"),
    IF("if"),
    INT("int"),
    LONG("long"),
    REGISTER("register"),
    RETURN("return"),
    SHORT("short"),
    SIGNED("signed"),
    SIZEOF("sizeof"),
    STATIC("static"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPEDEF("typedef"),
    UNION("union"),
    UNSIGNED("unsigned"),
    VOID("void"),
    VOLATILE("volatile"),
    WHILE("while");

    private static final Map<String, Keyword> BY_TEXT = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Keyword::getText, Function.identity()));

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    /**
     * Case-sensitive lookup; {@code "Int"} is not a keyword.
     */
    public static Optional<Keyword> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }

    public static boolean isKeyword(String text) {
        return BY_TEXT.containsKey(text);
    }
}
