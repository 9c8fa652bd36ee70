package com.example.pipelinesync.exception;

import lombok.Getter;

/**
 * 5xx, timeout or connection failure that persisted through every retry.
 */
@Getter
public class RemoteServiceException extends SyncException {

    private final int status;

    public RemoteServiceException(String message, int status) {
        super("REMOTE_UNAVAILABLE", message);
        this.status = status;
    }

    public RemoteServiceException(String message, Throwable cause) {
        super("REMOTE_UNAVAILABLE", message, cause);
        this.status = 0;
    }
}
