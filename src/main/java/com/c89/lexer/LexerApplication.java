package com.c89.lexer;

import com.c89.lexer.cli.LexCommand;
import picocli.CommandLine;

/**
 * Main entry point for the C89 lexer.
 * Reads one C source file and prints its token stream, one token per line.
 */
public class LexerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LexCommand()).execute(args);
        System.exit(exitCode);
    }
}
