package com.c89.lexer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.c89.lexer.cli.exception.OptionsValidationException;
import com.c89.lexer.cli.model.LexOptions;
import com.c89.lexer.cli.model.ValidatedLexOptions;
import com.c89.lexer.config.LexerConfig;

public class LexOptionsValidator {

	public ValidatedLexOptions validate(LexOptions o) {
		List<String> errors = new ArrayList<>();

		Path sourceFile = o.getSourceFile();
		if (sourceFile == null) {
			errors.add("A C source file is required.");
		} else if (!Files.exists(sourceFile)) {
			errors.add("Source file does not exist: " + sourceFile);
		} else if (!Files.isRegularFile(sourceFile)) {
			errors.add("Source file is not a regular file: " + sourceFile);
		} else if (!Files.isReadable(sourceFile)) {
			errors.add("Source file is not readable: " + sourceFile);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		LexerConfig config = LexerConfig.builder()
				.allowLineComments(o.isLineComments())
				.retainComments(o.isKeepComments())
				.build();

		return new ValidatedLexOptions(sourceFile.toAbsolutePath().normalize(), config, !o.isSuppressDiagnostics());
	}
}
