package com.c89.lexer.scanner;

import com.c89.lexer.model.Diagnostic;

/**
 * Raised when scanning cannot continue. Carries the fatal diagnostic.
 */
public class LexicalException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient Diagnostic diagnostic;

    public LexicalException(Diagnostic diagnostic) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
