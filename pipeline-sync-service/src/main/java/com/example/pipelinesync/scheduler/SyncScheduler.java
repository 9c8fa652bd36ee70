package com.example.pipelinesync.scheduler;

import com.example.pipelinesync.config.MirrorSyncProperties;
import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.service.SyncOrchestrator;
import com.example.pipelinesync.service.SyncRunResult;
import com.example.pipelinesync.service.mirror.TargetOpportunitySyncService;
import com.example.pipelinesync.service.pipeline.StageTransitionEngine;
import com.example.pipelinesync.service.pipeline.TransitionBatchResult;
import com.example.pipelinesync.service.pipeline.TransitionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Recurring triggers for the mirror sync and the stage-transition batch.
 *
 * CRITICAL DESIGN:
 * - @SchedulerLock ensures only ONE instance executes each job (multi-replica safe)
 * - Delegates to the service layer, no business logic here
 * - Correlation ID per trigger for tracing
 * - Disabled with sync.scheduler.enabled=false (one-shot runs disable it)
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler {

    private final SyncOrchestrator syncOrchestrator;
    private final StageTransitionEngine stageTransitionEngine;
    private final MirrorSyncProperties mirrorProperties;

    /**
     * Default: every 15 minutes.
     */
    @Scheduled(cron = "${sync.scheduler.incremental-cron:0 */15 * * * *}")
    @SchedulerLock(name = "mirrorIncrementalSync", lockAtMostFor = "14m", lockAtLeastFor = "30s")
    public void mirrorIncremental() {
        runMirror("INCREMENTAL", SyncMode.INCREMENTAL, mirrorProperties.getEntities());
    }

    /**
     * Default: nightly at 03:00.
     */
    @Scheduled(cron = "${sync.scheduler.full-cron:0 0 3 * * *}")
    @SchedulerLock(name = "mirrorFullSync", lockAtMostFor = "3h", lockAtLeastFor = "1m")
    public void mirrorFull() {
        runMirror("FULL", SyncMode.FULL, mirrorProperties.getEntities());
    }

    @Scheduled(cron = "${sync.scheduler.target-opportunities-cron:0 5/15 * * * *}")
    @SchedulerLock(name = "targetOpportunitySync", lockAtMostFor = "14m", lockAtLeastFor = "30s")
    public void targetOpportunities() {
        runMirror("TARGET", SyncMode.FULL, List.of(TargetOpportunitySyncService.ENTITY_NAME));
    }

    @Scheduled(cron = "${sync.scheduler.stage-transitions-cron:0 10/15 * * * *}")
    @SchedulerLock(name = "stageTransitions", lockAtMostFor = "14m", lockAtLeastFor = "30s")
    public void stageTransitions() {
        String correlationId = "SCHEDULER-TRANSITIONS-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            log.info("=== Starting scheduled stage transitions: correlationId={} ===", correlationId);
            Map<TransitionType, TransitionBatchResult> results = stageTransitionEngine.runAll(false);
            results.values().forEach(result -> log.info("Transition batch: {}", result));
            log.info("=== Completed scheduled stage transitions: correlationId={} ===", correlationId);
        } catch (Exception e) {
            log.error("Error in scheduled stage transitions: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }

    private void runMirror(String label, SyncMode mode, List<String> entities) {
        String correlationId = "SCHEDULER-" + label + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            log.info("=== Starting scheduled {} sync: entities={}, correlationId={} ===", label, entities, correlationId);
            Map<String, SyncRunResult> results = syncOrchestrator.runAll(entities, mode);
            long failed = results.values().stream().filter(result -> !result.isSuccess()).count();
            log.info("=== Completed scheduled {} sync: entities={}, failed={} ===", label, results.size(), failed);
        } catch (Exception e) {
            log.error("Error in scheduled {} sync: {}", label, e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
