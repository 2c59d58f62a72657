package com.c89.lexer.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.c89.lexer.config.LexerConfig;
import com.c89.lexer.model.LexResult;
import com.c89.lexer.scanner.CLexer;

/**
 * Loads a C source file and scans it.
 * <p>
 * Files are read as ISO-8859-1 so that every byte becomes exactly one character; bytes above
 * 0x7F then surface as unknown characters outside literals and comments.
 */
public class SourceLexingService {
    private static final Logger log = LoggerFactory.getLogger(SourceLexingService.class);

    public LexResult lex(Path sourceFile, LexerConfig config) throws IOException {
        String source = Files.readString(sourceFile, StandardCharsets.ISO_8859_1);
        log.debug("Read {} characters from {}", source.length(), sourceFile);

        LexResult result = lex(source, config);
        if (result.isFatal()) {
            log.warn("Scan of {} stopped: {}", sourceFile,
                    result.fatalDiagnostic().map(d -> d.format()).orElse("fatal error"));
        } else {
            log.info("Scanned {}: {}", sourceFile.getFileName(), summarize(result));
        }
        return result;
    }

    public LexResult lex(String source, LexerConfig config) {
        return new CLexer(source, config).tokenize();
    }

    /**
     * One-line count of a result. The end-of-file marker is not counted as a token.
     */
    static String summarize(LexResult result) {
        return result.significantTokens().size() + " tokens, " + result.getDiagnostics().size() + " diagnostics";
    }
}
