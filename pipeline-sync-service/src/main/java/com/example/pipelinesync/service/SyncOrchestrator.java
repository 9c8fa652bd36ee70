package com.example.pipelinesync.service;

import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.entity.SyncRun;
import com.example.pipelinesync.exception.FetchAbortedException;
import com.example.pipelinesync.metrics.SyncMetrics;
import com.example.pipelinesync.service.mirror.SyncStats;
import com.example.pipelinesync.service.mirror.SyncTask;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs sync tasks one after another and records each in the sync-run log.
 *
 * CRITICAL DESIGN:
 * - Sequential, never parallel, to bound load on both remote systems
 * - Run row inserted as STARTED before the task, sealed COMPLETED / FAILED after
 * - One entity's failure never stops the ones after it
 * - Remote calls happen outside transactions; only the run bookkeeping is transactional
 */
@Service
@Slf4j
public class SyncOrchestrator {

    private final Map<String, SyncTask> tasks;
    private final SyncRunService syncRunService;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    public SyncOrchestrator(List<SyncTask> tasks, SyncRunService syncRunService, SyncMetrics syncMetrics, Clock clock) {
        this.tasks = tasks.stream().collect(Collectors.toMap(SyncTask::name, Function.identity(),
                (a, b) -> {
                    throw new IllegalStateException("Duplicate sync task name: " + a.name());
                },
                LinkedHashMap::new));
        this.syncRunService = syncRunService;
        this.syncMetrics = syncMetrics;
        this.clock = clock;
    }

    public List<String> taskNames() {
        return List.copyOf(tasks.keySet());
    }

    public Map<String, SyncRunResult> runAll(List<String> entityNames, SyncMode mode) {
        return runAll(entityNames, mode, null);
    }

    /**
     * @param since incremental lower bound applied to every entity, {@code null} for each entity's watermark
     * @throws IllegalArgumentException for an unknown entity name, before anything runs
     */
    public Map<String, SyncRunResult> runAll(List<String> entityNames, SyncMode mode, Instant since) {
        List<String> unknown = entityNames.stream().filter(name -> !tasks.containsKey(name)).toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown sync entities " + unknown + ", known: " + tasks.keySet());
        }

        boolean ownsCorrelationId = MDC.get("correlationId") == null;
        if (ownsCorrelationId) {
            MDC.put("correlationId", "SYNC-" + UUID.randomUUID().toString().substring(0, 8));
        }

        try {
            log.info("Starting sync: entities={}, mode={}, since={}", entityNames, mode, since);
            Map<String, SyncRunResult> results = new LinkedHashMap<>();
            for (String entityName : entityNames) {
                results.put(entityName, runOne(tasks.get(entityName), mode, since));
            }

            long failed = results.values().stream().filter(r -> !r.isSuccess()).count();
            log.info("Finished sync: entities={}, succeeded={}, failed={}",
                    entityNames.size(), entityNames.size() - failed, failed);
            return results;
        } finally {
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }

    private SyncRunResult runOne(SyncTask task, SyncMode mode, Instant since) {
        String correlationId = MDC.get("correlationId");
        Instant startedAt = clock.instant();
        SyncRun run = null;

        try {
            run = syncRunService.start(task.name(), mode, correlationId);
            SyncStats stats = task.run(mode, since);
            syncRunService.complete(run.getId(), stats);
            Duration duration = Duration.between(startedAt, clock.instant());
            syncMetrics.recordRun(task.name(), SyncRun.RunStatus.COMPLETED, duration, stats);

            return SyncRunResult.builder()
                    .entityName(task.name())
                    .mode(mode)
                    .syncRunId(run.getId())
                    .success(true)
                    .stats(stats)
                    .durationMs(duration.toMillis())
                    .correlationId(correlationId)
                    .build();
        } catch (RuntimeException e) {
            SyncStats partial = e instanceof FetchAbortedException aborted ? aborted.getPartialStats() : new SyncStats();
            if (run != null) {
                syncRunService.fail(run.getId(), partial, e.getMessage());
            } else {
                log.error("Sync run could not be recorded: entity={}, error={}", task.name(), e.getMessage());
            }
            Duration duration = Duration.between(startedAt, clock.instant());
            syncMetrics.recordRun(task.name(), SyncRun.RunStatus.FAILED, duration, partial);

            return SyncRunResult.builder()
                    .entityName(task.name())
                    .mode(mode)
                    .syncRunId(run != null ? run.getId() : null)
                    .success(false)
                    .stats(partial)
                    .durationMs(duration.toMillis())
                    .errorMessage(e.getMessage())
                    .correlationId(correlationId)
                    .build();
        }
    }
}
