package com.gdin.inspection.gsw.exception;

import lombok.Getter;

/**
 * Unrecoverable failure after the resolve phase. The workspace has been rolled back
 * to its pre-batch state and the ingestion cursor was not touched.
 */
@Getter
public class BatchFailedException extends WorkspaceException {

    private final String step;

    public BatchFailedException(String step, Throwable cause) {
        super("batch failed at step " + step + ": " + (cause == null ? "" : cause.getMessage()), cause);
        this.step = step;
    }
}
