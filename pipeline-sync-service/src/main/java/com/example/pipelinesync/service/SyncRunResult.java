package com.example.pipelinesync.service;

import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.service.mirror.SyncStats;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one entity within an orchestrated run.
 */
@Getter
@Builder
public class SyncRunResult {

    private final String entityName;
    private final SyncMode mode;
    private final Long syncRunId;
    private final boolean success;
    private final SyncStats stats;
    private final long durationMs;
    private final String errorMessage;
    private final String correlationId;
}
