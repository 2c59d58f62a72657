package com.c89.lexer.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the lexer command. No validation, no execution logic, no printing.
 */
@Getter
public class LexOptions {

	@Parameters(index = "0", paramLabel = "FILE", description = "C source file to scan")
	private Path sourceFile;

	@Option(names = { "--line-comments",
			"-l" }, description = "Accept // line comments (not part of C89)")
	private boolean lineComments;

	@Option(names = { "--keep-comments",
			"-k" }, description = "Print comments as COMMENT tokens instead of discarding them")
	private boolean keepComments;

	@Option(names = { "--no-diagnostics" }, description = "Do not print lexical errors to standard error")
	private boolean suppressDiagnostics;

}
