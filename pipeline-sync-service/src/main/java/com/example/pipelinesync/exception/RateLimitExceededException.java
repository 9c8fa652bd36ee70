package com.example.pipelinesync.exception;

/**
 * HTTP 429 that persisted through every retry.
 */
public class RateLimitExceededException extends SyncException {

    public RateLimitExceededException(String message) {
        super("RATE_LIMITED", message);
    }
}
