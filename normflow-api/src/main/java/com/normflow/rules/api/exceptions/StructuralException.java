package com.normflow.rules.api.exceptions;

/**
 * Thrown when a parsed diagram violates a structural invariant of the reduced graph,
 * e.g. it does not have exactly one entry node or has no exit node.
 */
public class StructuralException extends CompilationException {

    public StructuralException(String message) {
        super(message);
    }
}
