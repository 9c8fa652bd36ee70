package com.example.pipelinesync.cli;

import com.example.pipelinesync.config.MirrorSyncProperties;
import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.service.SyncOrchestrator;
import com.example.pipelinesync.service.SyncRunResult;
import com.example.pipelinesync.service.mirror.SyncStats;
import com.example.pipelinesync.service.mirror.TargetOpportunitySyncService;
import com.example.pipelinesync.service.pipeline.StageTransitionEngine;
import com.example.pipelinesync.service.pipeline.TransitionBatchResult;
import com.example.pipelinesync.service.pipeline.TransitionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OneShotRunnerTest {

    private static final Instant NOW = Instant.parse("2024-05-20T12:00:00Z");

    private SyncOrchestrator orchestrator;
    private StageTransitionEngine engine;
    private ByteArrayOutputStream output;
    private OneShotRunner runner;

    @BeforeEach
    void setUp() {
        orchestrator = mock(SyncOrchestrator.class);
        engine = mock(StageTransitionEngine.class);
        output = new ByteArrayOutputStream();
        MirrorSyncProperties mirrorProperties = new MirrorSyncProperties();
        mirrorProperties.setEntities(List.of("customers", "estimates"));
        runner = new OneShotRunner(orchestrator, engine, mirrorProperties, Clock.fixed(NOW, ZoneOffset.UTC),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void singleEntityRunUsesLookbackWindow() {
        // GIVEN
        when(orchestrator.runAll(eq(List.of("jobs")), eq(SyncMode.INCREMENTAL), any()))
                .thenReturn(results(result("jobs", true)));

        // WHEN
        int exitCode = runner.execute(new OneShotCommand("jobs", SyncMode.INCREMENTAL, Duration.ofDays(14), false));

        // THEN
        assertThat(exitCode).isEqualTo(OneShotRunner.SUCCESS);
        verify(orchestrator).runAll(List.of("jobs"), SyncMode.INCREMENTAL, NOW.minus(Duration.ofDays(14)));
        verifyNoInteractions(engine);
        assertThat(printed()).contains("SYNC entity=jobs mode=INCREMENTAL status=completed").contains("RESULT success");
    }

    @Test
    void failedEntityGivesNonZeroExit() {
        when(orchestrator.runAll(anyList(), any(), isNull()))
                .thenReturn(results(result("jobs", false)));

        int exitCode = runner.execute(new OneShotCommand("jobs", SyncMode.FULL, null, false));

        assertThat(exitCode).isEqualTo(OneShotRunner.FAILURE);
        assertThat(printed()).contains("status=failed").contains("error=boom").contains("RESULT failure");
    }

    @Test
    void stageTransitionsPassDryRunThrough() {
        Map<TransitionType, TransitionBatchResult> batch = new EnumMap<>(TransitionType.class);
        batch.put(TransitionType.SOLD, new TransitionBatchResult(TransitionType.SOLD, true));
        when(engine.runAll(true)).thenReturn(batch);

        int exitCode = runner.execute(new OneShotCommand(OneShotCommand.STAGE_TRANSITIONS, SyncMode.INCREMENTAL, null, true));

        assertThat(exitCode).isEqualTo(OneShotRunner.SUCCESS);
        verifyNoInteractions(orchestrator);
        assertThat(printed()).contains("TRANSITIONS type=SOLD detected=0").contains("dryRun=true");
    }

    @Test
    void allRunsMirrorThenOpportunitiesThenTransitions() {
        // GIVEN: the mirror succeeds but a transition fails
        when(orchestrator.runAll(anyList(), any(), any()))
                .thenReturn(results(result("customers", true), result("estimates", true)));
        TransitionBatchResult failed = mock(TransitionBatchResult.class);
        when(failed.hasFailures()).thenReturn(true);
        when(engine.runAll(false)).thenReturn(Map.of(TransitionType.SOLD, failed));

        // WHEN
        int exitCode = runner.execute(new OneShotCommand(OneShotCommand.ALL, SyncMode.INCREMENTAL, null, false));

        // THEN
        verify(orchestrator).runAll(
                List.of("customers", "estimates", TargetOpportunitySyncService.ENTITY_NAME), SyncMode.INCREMENTAL, null);
        verify(engine).runAll(false);
        assertThat(exitCode).isEqualTo(OneShotRunner.FAILURE);
    }

    @Test
    void unexpectedErrorIsReported() {
        when(orchestrator.runAll(anyList(), any(), any())).thenThrow(new IllegalArgumentException("Unknown sync entities [jbos]"));

        int exitCode = runner.execute(new OneShotCommand("jbos", SyncMode.INCREMENTAL, null, false));

        assertThat(exitCode).isEqualTo(OneShotRunner.FAILURE);
        assertThat(printed()).contains("ERROR Unknown sync entities [jbos]");
    }

    @Test
    void invalidArgumentsSetFailureExitCode() {
        runner.run(new DefaultApplicationArguments("--run=jobs", "--mode=sideways"));

        assertThat(runner.getExitCode()).isEqualTo(OneShotRunner.FAILURE);
        assertThat(printed()).contains("ERROR --mode");
        verify(orchestrator, never()).runAll(anyList(), any(), any());
        verify(engine, never()).runAll(anyBoolean());
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static Map<String, SyncRunResult> results(SyncRunResult... results) {
        Map<String, SyncRunResult> map = new LinkedHashMap<>();
        for (SyncRunResult result : results) {
            map.put(result.getEntityName(), result);
        }
        return map;
    }

    private static SyncRunResult result(String entity, boolean success) {
        return SyncRunResult.builder()
                .entityName(entity)
                .mode(SyncMode.INCREMENTAL)
                .syncRunId(1L)
                .success(success)
                .stats(new SyncStats())
                .durationMs(5L)
                .errorMessage(success ? null : "boom")
                .build();
    }
}
