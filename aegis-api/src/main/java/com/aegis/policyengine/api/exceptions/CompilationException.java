package com.aegis.policyengine.api.exceptions;

/**
 * Raised when a constraint set cannot be turned into an evaluator, or when a policy
 * definition cannot be read.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompilationException(Throwable cause) {
        super(cause);
    }
}
