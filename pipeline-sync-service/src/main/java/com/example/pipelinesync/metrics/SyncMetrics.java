package com.example.pipelinesync.metrics;

import com.example.pipelinesync.entity.SyncRun;
import com.example.pipelinesync.service.mirror.SyncStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - sync_runs_total{entity,status}: sealed sync runs
 * - sync_run_duration_seconds{entity}: run duration
 * - sync_records_total{entity,outcome}: created / updated / failed records
 * - stage_transitions_total{type,outcome}: applied / skipped / not_found / failed candidates
 * - target_requests_total{method,outcome}: every Target attempt, by status class
 * - thread_pool_*{executor}: Target request queue gauges
 *
 * Access metrics: /actuator/prometheus
 */
@Component
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordRun(String entity, SyncRun.RunStatus status, Duration duration, SyncStats stats) {
        Counter.builder("sync_runs_total")
                .description("Sealed sync runs")
                .tag("entity", entity)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();

        Timer.builder("sync_run_duration_seconds")
                .description("Duration of sync runs")
                .tag("entity", entity)
                .register(meterRegistry)
                .record(duration);

        if (stats != null) {
            records(entity, "created").increment(stats.getCreated());
            records(entity, "updated").increment(stats.getUpdated());
            records(entity, "failed").increment(stats.getFailed());
        }
        log.debug("Recorded sync run: entity={}, status={}, duration={}ms", entity, status, duration.toMillis());
    }

    public void recordTransition(String type, String outcome) {
        Counter.builder("stage_transitions_total")
                .description("Stage-transition candidates by outcome")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param status HTTP status, 0 when the attempt failed before a response
     */
    public void recordTargetRequest(String method, int status) {
        Counter.builder("target_requests_total")
                .description("Target API attempts")
                .tag("method", method)
                .tag("outcome", outcomeOf(status))
                .register(meterRegistry)
                .increment();
    }

    public void registerThreadPoolMetrics(String executorName, ThreadPoolExecutor executor) {
        Gauge.builder("thread_pool_active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("executor", executorName)
                .description("Active thread count")
                .register(meterRegistry);

        Gauge.builder("thread_pool_queue_size", executor, e -> e.getQueue().size())
                .tag("executor", executorName)
                .description("Queue size")
                .register(meterRegistry);

        Gauge.builder("thread_pool_completed_tasks", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tag("executor", executorName)
                .description("Completed task count")
                .register(meterRegistry);
    }

    private Counter records(String entity, String outcome) {
        return Counter.builder("sync_records_total")
                .description("Mirrored records by outcome")
                .tag("entity", entity)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private static String outcomeOf(int status) {
        if (status == 0) {
            return "transport_error";
        }
        if (status == 429) {
            return "rate_limited";
        }
        return (status / 100) + "xx";
    }
}
