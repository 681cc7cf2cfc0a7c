package com.gdin.inspection.gsw.exception;

/**
 * Batch abandoned before anything was applied to the workspace.
 */
public class BatchAbortedException extends WorkspaceException {

    public BatchAbortedException(String message) {
        super(message);
    }

    public BatchAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
