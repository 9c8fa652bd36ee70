package com.example.pipelinesync.entity;

/**
 * How a fetcher walks the Source collection.
 */
public enum SyncMode {
    /** Page-numbered requests filtered by modifiedOnOrAfter. */
    INCREMENTAL,
    /** Export endpoint walked with an opaque continuation token. */
    FULL
}
