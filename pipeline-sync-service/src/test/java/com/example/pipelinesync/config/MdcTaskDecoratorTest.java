package com.example.pipelinesync.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Correlation id propagation from a submitting thread onto the Target request pool.
 */
class MdcTaskDecoratorTest {

    private static final String MDC_KEY = "correlationId";

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        TargetApiProperties properties = new TargetApiProperties();
        properties.setConcurrency(1);
        executor = AsyncConfig.buildTargetRequestExecutor(properties);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    void shouldPropagateCorrelationIdToWorker() throws ExecutionException, InterruptedException {
        // GIVEN
        String correlationId = "SCHEDULER-transitions-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_KEY, correlationId);

        // WHEN
        String seen = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), executor).get();

        // THEN
        assertEquals(correlationId, seen);
    }

    @Test
    void shouldIsolateConcurrentSubmitters() throws Exception {
        // GIVEN: a single worker thread reused by every submission
        List<CompletableFuture<String>> futures = new ArrayList<>();
        List<String> expected = new ArrayList<>();

        // WHEN
        for (int i = 0; i < 5; i++) {
            String correlationId = "CLI-" + i;
            expected.add(correlationId);
            MDC.put(MDC_KEY, correlationId);
            futures.add(CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), executor));
        }

        // THEN
        List<String> seen = new ArrayList<>();
        for (CompletableFuture<String> future : futures) {
            seen.add(future.get());
        }
        assertEquals(expected, seen);
    }

    @Test
    void shouldNotLeakContextIntoLaterTasks() throws Exception {
        // GIVEN: a task submitted with a correlation id
        MDC.put(MDC_KEY, "TRANSITION-1");
        CompletableFuture.runAsync(() -> { }, executor).get();

        // WHEN: the next task is submitted without one
        MDC.clear();
        String seen = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), executor).get();

        // THEN
        assertNull(seen);
    }
}
