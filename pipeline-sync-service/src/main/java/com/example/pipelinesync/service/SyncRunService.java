package com.example.pipelinesync.service;

import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.entity.SyncRun;
import com.example.pipelinesync.repository.SyncRunRepository;
import com.example.pipelinesync.service.mirror.SyncStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Sync-run log writes, each in its own short transaction.
 * No remote calls happen inside these methods.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncRunService {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final SyncRunRepository syncRunRepository;
    private final Clock clock;

    @Transactional
    public SyncRun start(String entityName, SyncMode mode, String correlationId) {
        SyncRun run = SyncRun.builder()
                .entityName(entityName)
                .mode(mode)
                .build();
        run.markAsStarted(clock.instant(), correlationId);

        SyncRun saved = syncRunRepository.save(run);
        log.debug("Created sync run id={} for entity={}, mode={}", saved.getId(), entityName, mode);
        return saved;
    }

    @Transactional
    public SyncRun complete(Long runId, SyncStats stats) {
        SyncRun run = load(runId);
        run.markAsCompleted(clock.instant(), stats.getFetched(), stats.getCreated(),
                stats.getUpdated(), stats.getFailed());
        SyncRun saved = syncRunRepository.save(run);

        log.info("Sync run id={} completed: entity={}, {}, duration={}ms",
                runId, run.getEntityName(), stats, run.getDurationMs());
        return saved;
    }

    @Transactional
    public SyncRun fail(Long runId, SyncStats partialStats, String errorMessage) {
        SyncRun run = load(runId);
        run.markAsFailed(clock.instant(), partialStats.getFetched(), partialStats.getCreated(),
                partialStats.getUpdated(), partialStats.getFailed(), truncate(errorMessage));
        SyncRun saved = syncRunRepository.save(run);

        log.error("Sync run id={} failed: entity={}, {}, error={}",
                runId, run.getEntityName(), partialStats, errorMessage);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<SyncRun> recentRuns(String entityName) {
        return syncRunRepository.findTop20ByEntityNameOrderByStartedAtDesc(entityName);
    }

    private SyncRun load(Long runId) {
        return syncRunRepository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("SyncRun not found: " + runId));
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
