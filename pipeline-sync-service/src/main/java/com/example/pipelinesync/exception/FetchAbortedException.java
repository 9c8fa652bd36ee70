package com.example.pipelinesync.exception;

import com.example.pipelinesync.service.mirror.SyncStats;
import lombok.Getter;

/**
 * A fetch-level error stopped the run. Carries what the run committed before stopping.
 */
@Getter
public class FetchAbortedException extends SyncException {

    private final SyncStats partialStats;

    public FetchAbortedException(String entityName, SyncStats partialStats, Throwable cause) {
        super("FETCH_ABORTED",
                String.format("Fetch aborted for entity=%s: %s", entityName, cause.getMessage()),
                cause);
        this.partialStats = partialStats;
    }
}
