package com.example.pipelinesync.exception;

/**
 * Credential exchange failed or a token was rejected twice. Fatal for the current run.
 */
public class AuthenticationException extends SyncException {

    public AuthenticationException(String message) {
        super("AUTH_FAILED", message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super("AUTH_FAILED", message, cause);
    }
}
