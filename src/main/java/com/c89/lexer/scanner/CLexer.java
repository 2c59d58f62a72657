package com.c89.lexer.scanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.c89.lexer.config.LexerConfig;
import com.c89.lexer.model.Diagnostic;
import com.c89.lexer.model.DiagnosticKind;
import com.c89.lexer.model.LexResult;
import com.c89.lexer.model.LexerState;
import com.c89.lexer.model.SourcePosition;
import com.c89.lexer.model.Token;
import com.c89.lexer.model.TokenKind;

/**
 * Lexer for C89 source text.
 * <p>
 * Each call to {@link #nextToken()} skips whitespace (and comments, unless they are retained),
 * then tries the matchers in fixed priority order: comment, preprocessor directive,
 * identifier/keyword, numeric constant, character constant, string literal, punctuator. A
 * character none of them accepts is reported as unknown and skipped.
 * <p>
 * Recoverable errors become {@link TokenKind#INVALID} tokens and are collected as diagnostics;
 * the scan goes on. An unterminated block comment ends the scan in {@link LexerState#FATAL}
 * without an end-of-file token.
 * <p>
 * An instance scans one buffer once and is not thread-safe; independent instances share nothing.
 */
public class CLexer {
    private static final Logger log = LoggerFactory.getLogger(CLexer.class);

    private final SourceCursor cursor;
    private final LexerConfig config;
    private final List<TokenMatcher> matchers;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private LexerState state = LexerState.SCANNING;

    public CLexer(String source) {
        this(source, LexerConfig.strict());
    }

    public CLexer(String source, LexerConfig config) {
        this.cursor = new SourceCursor(source);
        this.config = config;
        this.matchers = List.of(
                new CommentMatcher(config),
                new DirectiveMatcher(),
                new IdentifierMatcher(),
                new NumberMatcher(),
                new CharacterConstantMatcher(),
                new StringLiteralMatcher(),
                new PunctuatorMatcher());
    }

    /**
     * Scans the whole buffer. Never throws for lexical errors; a fatal error is reported through
     * the result's state and diagnostics.
     */
    public LexResult tokenize() {
        List<Token> tokens = new ArrayList<>();
        try {
            Token token;
            do {
                token = nextToken();
                tokens.add(token);
            } while (!token.is(TokenKind.END_OF_FILE));
        } catch (LexicalException e) {
            log.debug("Scan stopped after {} tokens: {}", tokens.size(), e.getMessage());
        }

        log.debug("Scanned {} tokens, {} diagnostics, final state {}", tokens.size(), diagnostics.size(), state);
        return LexResult.builder()
                .tokens(tokens)
                .diagnostics(diagnostics)
                .state(state)
                .build();
    }

    /**
     * Produces the next token; the last one is {@link TokenKind#END_OF_FILE}.
     *
     * @throws LexicalException     when the scan hits a fatal error; the lexer is then {@link LexerState#FATAL}
     * @throws IllegalStateException when called after the scan has ended
     */
    public Token nextToken() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Scan already ended in state " + state);
        }

        while (true) {
            skipWhitespace();
            if (cursor.isAtEnd()) {
                transition(LexerState.DONE);
                SourcePosition end = cursor.mark();
                return Token.builder()
                        .kind(TokenKind.END_OF_FILE)
                        .lexeme("")
                        .offset(end.getOffset())
                        .line(end.getLine())
                        .column(end.getColumn())
                        .build();
            }

            MatchResult result = matchNext();
            if (result.getKind() == TokenKind.COMMENT && !config.isRetainComments()) {
                continue;
            }
            if (result.isError()) {
                Diagnostic diagnostic = result.toDiagnostic();
                log.debug("Recoverable lexical error at {}:{}: {}", diagnostic.getLine(), diagnostic.getColumn(),
                        diagnostic.getMessage());
                diagnostics.add(diagnostic);
            }
            return result.toToken();
        }
    }

    public LexerState getState() {
        return state;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private MatchResult matchNext() {
        for (TokenMatcher matcher : matchers) {
            if (!matcher.canStart(cursor)) {
                continue;
            }
            transition(matcher.activeState());
            try {
                return matcher.match(cursor);
            } catch (LexicalException e) {
                transition(LexerState.FATAL);
                diagnostics.add(e.getDiagnostic());
                throw e;
            } finally {
                if (state != LexerState.FATAL) {
                    transition(LexerState.SCANNING);
                }
            }
        }
        return unknownCharacter();
    }

    private void transition(LexerState next) {
        if (next != state) {
            log.debug("{} -> {} at {}:{}", state, next, cursor.getLine(), cursor.getColumn());
            state = next;
        }
    }

    private MatchResult unknownCharacter() {
        SourcePosition start = cursor.mark();
        char c = cursor.advance();
        String message = c >= 0x20 && c < 0x7F
                ? "unknown character '" + c + "'"
                : String.format("unknown character \\x%02X", (int) c);
        return MatchResult.error(DiagnosticKind.UNKNOWN_CHARACTER, start, cursor.slice(start), message);
    }

    private void skipWhitespace() {
        while (CharClasses.isWhitespace(cursor.peek())) {
            cursor.advance();
        }
    }
}
