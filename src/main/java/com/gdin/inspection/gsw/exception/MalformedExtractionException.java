package com.gdin.inspection.gsw.exception;

/**
 * A single candidate is missing required fields or names an unknown entity type.
 * Only that candidate is dropped.
 */
public class MalformedExtractionException extends WorkspaceException {

    public MalformedExtractionException(String message) {
        super(message);
    }
}
