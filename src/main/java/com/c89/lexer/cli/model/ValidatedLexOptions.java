package com.c89.lexer.cli.model;

import java.nio.file.Path;

import com.c89.lexer.config.LexerConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Values derived from {@link LexOptions} once they passed validation.
 */
@Data
@AllArgsConstructor
public class ValidatedLexOptions {
    Path sourceFile;
    LexerConfig lexerConfig;
    boolean printDiagnostics;
}
