package com.c89.lexer.cli.output;

import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.c89.lexer.cli.model.ValidatedLexOptions;
import com.c89.lexer.model.Diagnostic;
import com.c89.lexer.model.LexResult;
import com.c89.lexer.model.Token;
import com.c89.lexer.model.TokenKind;

/**
 * Responsible only for CLI output of the lexer command.
 * The token listing goes to standard output, diagnostics to standard error, and the banner and
 * summary to the log.
 */
public class TokenListingPrinter {

    private static final Logger log = LoggerFactory.getLogger(TokenListingPrinter.class);

    private final PrintStream out;
    private final PrintStream err;

    public TokenListingPrinter(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public void printBanner(ValidatedLexOptions v) {
        log.info("=================================================");
        log.info("C89 Lexer");
        log.info("=================================================");
        log.info("Source File: {}", v.getSourceFile());
        log.info("Line Comments: {}", v.getLexerConfig().isAllowLineComments() ? "enabled" : "disabled");
        log.info("Keep Comments: {}", v.getLexerConfig().isRetainComments());
        log.info("=================================================");
    }

    /**
     * One line per token, {@code (line, KIND, lexeme)}, in source order. Punctuators are labelled
     * {@code OPERATOR} or {@code DELIMITER}; the end-of-file token is not listed.
     */
    public void printTokens(LexResult result) {
        for (Token token : result.getTokens()) {
            if (token.is(TokenKind.END_OF_FILE)) {
                continue;
            }
            out.println("(" + token.getLine() + ", " + label(token) + ", " + printable(token.getLexeme()) + ")");
        }
        out.flush();
    }

    public void printDiagnostics(LexResult result) {
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            err.println(diagnostic.format());
        }
        err.flush();
    }

    public void printSummary(LexResult result) {
        log.info("");
        log.info("Tokens: {}", result.significantTokens().size());
        log.info("Lexical Errors: {}", result.getDiagnostics().size());
        if (result.isFatal()) {
            log.error("Scan aborted: {}", result.fatalDiagnostic().map(Diagnostic::getMessage).orElse("fatal error"));
        }
    }

    static String label(Token token) {
        return token.punctuator()
                .map(p -> p.getCategory().name())
                .orElse(token.getKind().name());
    }

    /**
     * Escapes line breaks so a directive with continuations stays on one output line.
     */
    static String printable(String lexeme) {
        return lexeme.replace("\r", "\\r").replace("\n", "\\n");
    }
}
