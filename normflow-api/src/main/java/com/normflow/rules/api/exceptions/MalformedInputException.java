package com.normflow.rules.api.exceptions;

/**
 * Thrown when the diagram markup cannot be read or contains no process container.
 */
public class MalformedInputException extends CompilationException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
