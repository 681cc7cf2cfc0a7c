package com.gdin.inspection.gsw.exception;

/**
 * Base type of every failure raised by the workspace core.
 */
public class WorkspaceException extends RuntimeException {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
