package com.gdin.inspection.gsw.exception;

/**
 * The similarity oracle failed or timed out. The resolver degrades to exact-alias matching.
 */
public class OracleUnavailableException extends WorkspaceException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
