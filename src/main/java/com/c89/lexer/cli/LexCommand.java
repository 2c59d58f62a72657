package com.c89.lexer.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.c89.lexer.cli.exception.OptionsValidationException;
import com.c89.lexer.cli.model.LexOptions;
import com.c89.lexer.cli.model.ValidatedLexOptions;
import com.c89.lexer.cli.output.TokenListingPrinter;
import com.c89.lexer.cli.validation.LexOptionsValidator;
import com.c89.lexer.model.LexResult;
import com.c89.lexer.service.SourceLexingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that scans one C89 source file and prints its tokens.
 * <p>
 * Exit codes: {@value #EXIT_OK} when the scan completed, recoverable lexical errors included;
 * {@value #EXIT_FATAL} when it stopped on a fatal error; {@value #EXIT_USAGE} when the input
 * could not be read or the options are invalid.
 */
@Command(
        name = "c89-lexer",
        mixinStandardHelpOptions = true,
        version = "c89-lexer 1.0.0",
        description = "Splits a C89 source file into tokens and prints them as (line, KIND, lexeme)."
)
public class LexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LexCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_USAGE = 2;

    @Mixin
    private LexOptions options = new LexOptions();

    private final LexOptionsValidator validator = new LexOptionsValidator();
    private final SourceLexingService lexingService = new SourceLexingService();
    private final TokenListingPrinter printer;

    public LexCommand() {
        this(System.out, System.err);
    }

    public LexCommand(PrintStream out, PrintStream err) {
        this.printer = new TokenListingPrinter(out, err);
    }

    @Override
    public Integer call() {
        ValidatedLexOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return EXIT_USAGE;
        }

        printer.printBanner(validated);

        LexResult result;
        try {
            result = lexingService.lex(validated.getSourceFile(), validated.getLexerConfig());
        } catch (IOException e) {
            log.error("Failed to read source file {}", validated.getSourceFile(), e);
            return EXIT_USAGE;
        }

        printer.printTokens(result);
        if (validated.isPrintDiagnostics()) {
            printer.printDiagnostics(result);
        }
        printer.printSummary(result);

        return result.isFatal() ? EXIT_FATAL : EXIT_OK;
    }
}
