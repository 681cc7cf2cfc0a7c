package com.gdin.inspection.gsw.exception;

import lombok.Getter;

@Getter
public class SnapshotSchemaMismatchException extends WorkspaceException {

    private final String expected;
    private final String actual;

    public SnapshotSchemaMismatchException(String expected, String actual) {
        super("snapshot schema version mismatch: expected=" + expected + ", actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
