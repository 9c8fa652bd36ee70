package com.example.pipelinesync.exception;

/**
 * Another run already holds the per-entity lock.
 */
public class SyncInProgressException extends SyncException {

    public SyncInProgressException(String entityName) {
        super("SYNC_IN_PROGRESS", String.format("A sync for entity=%s is already running", entityName));
    }
}
