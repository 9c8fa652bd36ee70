package com.example.pipelinesync.service.mirror;

import com.example.pipelinesync.entity.SyncMode;

import java.time.Instant;

/**
 * A unit the orchestrator can run and record in the sync-run log.
 */
public interface SyncTask {

    /**
     * Entity name used for cursors, locks and the sync-run log.
     */
    String name();

    /**
     * @param since lower bound for incremental runs, {@code null} to use the stored watermark
     * @throws com.example.pipelinesync.exception.FetchAbortedException when a fetch-level error stops the run
     */
    SyncStats run(SyncMode mode, Instant since);
}
