package com.gdin.inspection.gsw.exception;

import lombok.Getter;

/**
 * An event or question points at an entity id that does not exist after the apply phase.
 */
@Getter
public class ReferenceIntegrityException extends WorkspaceException {

    private final String reference;

    public ReferenceIntegrityException(String reference, String message) {
        super(message);
        this.reference = reference;
    }
}
