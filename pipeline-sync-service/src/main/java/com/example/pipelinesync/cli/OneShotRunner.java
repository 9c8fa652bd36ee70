package com.example.pipelinesync.cli;

import com.example.pipelinesync.config.MirrorSyncProperties;
import com.example.pipelinesync.service.SyncOrchestrator;
import com.example.pipelinesync.service.SyncRunResult;
import com.example.pipelinesync.service.mirror.TargetOpportunitySyncService;
import com.example.pipelinesync.service.pipeline.StageTransitionEngine;
import com.example.pipelinesync.service.pipeline.TransitionBatchResult;
import com.example.pipelinesync.service.pipeline.TransitionType;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One-shot run of a fetcher, the whole mirror, the opportunity refresh or the transition batch.
 * Exit code 0 when everything succeeded, 1 otherwise. The sync-run log remains the durable
 * record of each run.
 */
@Component
@ConditionalOnProperty(name = OneShotCommand.RUN_OPTION)
@Slf4j
public class OneShotRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int SUCCESS = 0;
    static final int FAILURE = 1;

    private final SyncOrchestrator syncOrchestrator;
    private final StageTransitionEngine stageTransitionEngine;
    private final MirrorSyncProperties mirrorProperties;
    private final Clock clock;
    private final PrintStream out;

    private int exitCode = SUCCESS;

    @Autowired
    public OneShotRunner(SyncOrchestrator syncOrchestrator, StageTransitionEngine stageTransitionEngine,
                         MirrorSyncProperties mirrorProperties, Clock clock) {
        this(syncOrchestrator, stageTransitionEngine, mirrorProperties, clock, System.out);
    }

    OneShotRunner(SyncOrchestrator syncOrchestrator, StageTransitionEngine stageTransitionEngine,
                  MirrorSyncProperties mirrorProperties, Clock clock, PrintStream out) {
        this.syncOrchestrator = syncOrchestrator;
        this.stageTransitionEngine = stageTransitionEngine;
        this.mirrorProperties = mirrorProperties;
        this.clock = clock;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            exitCode = execute(OneShotCommand.parse(args));
        } catch (IllegalArgumentException e) {
            out.println("ERROR " + e.getMessage());
            exitCode = FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(OneShotCommand command) {
        String correlationId = "CLI-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);
        try {
            log.info("Starting one-shot run: {}, correlationId={}", command, correlationId);
            boolean ok = switch (command.target()) {
                case OneShotCommand.STAGE_TRANSITIONS -> runTransitions(command.dryRun());
                case OneShotCommand.ALL -> {
                    List<String> entities = new ArrayList<>(mirrorProperties.getEntities());
                    entities.add(TargetOpportunitySyncService.ENTITY_NAME);
                    boolean synced = runSync(entities, command);
                    yield runTransitions(command.dryRun()) && synced;
                }
                default -> runSync(List.of(command.target()), command);
            };
            out.println(ok ? "RESULT success" : "RESULT failure");
            return ok ? SUCCESS : FAILURE;
        } catch (RuntimeException e) {
            log.error("One-shot run failed: {}", e.getMessage(), e);
            out.println("ERROR " + e.getMessage());
            out.println("RESULT failure");
            return FAILURE;
        } finally {
            MDC.remove("correlationId");
        }
    }

    private boolean runSync(List<String> entities, OneShotCommand command) {
        if (command.dryRun() && !OneShotCommand.ALL.equals(command.target())) {
            log.warn("--dry-run only applies to stage transitions; running {} normally", entities);
        }
        Instant since = command.lookback() == null ? null : clock.instant().minus(command.lookback());
        Map<String, SyncRunResult> results = syncOrchestrator.runAll(entities, command.mode(), since);

        boolean ok = true;
        for (SyncRunResult result : results.values()) {
            out.printf("SYNC entity=%s mode=%s status=%s %s durationMs=%d runId=%s%s%n",
                    result.getEntityName(), result.getMode(), result.isSuccess() ? "completed" : "failed",
                    result.getStats(), result.getDurationMs(), result.getSyncRunId(),
                    result.isSuccess() ? "" : " error=" + result.getErrorMessage());
            ok &= result.isSuccess();
        }
        return ok;
    }

    private boolean runTransitions(boolean dryRun) {
        Map<TransitionType, TransitionBatchResult> results = stageTransitionEngine.runAll(dryRun);
        boolean ok = true;
        for (TransitionBatchResult result : results.values()) {
            out.println("TRANSITIONS " + result);
            ok &= !result.hasFailures();
        }
        return ok;
    }
}
