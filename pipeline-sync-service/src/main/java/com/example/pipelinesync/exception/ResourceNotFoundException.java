package com.example.pipelinesync.exception;

/**
 * A remote record the engine meant to touch no longer exists. Skipped, never retried.
 */
public class ResourceNotFoundException extends SyncException {

    public ResourceNotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static ResourceNotFoundException opportunity(String targetId) {
        return new ResourceNotFoundException(String.format("Opportunity %s not found in Target", targetId));
    }
}
