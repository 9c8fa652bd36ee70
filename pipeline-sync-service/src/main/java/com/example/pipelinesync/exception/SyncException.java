package com.example.pipelinesync.exception;

import lombok.Getter;

/**
 * Base exception for sync and reconciliation failures.
 */
@Getter
public abstract class SyncException extends RuntimeException {

    private final String code;

    protected SyncException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SyncException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
