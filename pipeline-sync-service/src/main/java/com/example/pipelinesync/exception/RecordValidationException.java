package com.example.pipelinesync.exception;

/**
 * A single Source record could not be projected. Counted as failed, the run continues.
 */
public class RecordValidationException extends SyncException {

    public RecordValidationException(String message) {
        super("INVALID_RECORD", message);
    }

    public RecordValidationException(String message, Throwable cause) {
        super("INVALID_RECORD", message, cause);
    }
}
