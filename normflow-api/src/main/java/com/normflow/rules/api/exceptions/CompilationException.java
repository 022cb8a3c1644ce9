package com.normflow.rules.api.exceptions;

/**
 * Exception thrown when a process diagram cannot be compiled into rules.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the pipeline, while still providing clear error messages
 * for compilation failures.
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
