package com.gdin.inspection.gsw.exception;

public class WorkspaceStorageException extends WorkspaceException {

    public WorkspaceStorageException(String message) {
        super(message);
    }

    public WorkspaceStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
