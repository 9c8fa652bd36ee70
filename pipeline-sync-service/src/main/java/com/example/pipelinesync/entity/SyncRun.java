package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * One execution of a sync task.
 * Inserted as STARTED and sealed exactly once as COMPLETED or FAILED.
 */
@Entity
@Table(name = "sync_runs", indexes = {
        @Index(name = "idx_sync_runs_entity_started", columnList = "entity_name,started_at"),
        @Index(name = "idx_sync_runs_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncRun extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_name", nullable = false, length = 100)
    private String entityName;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 20)
    private SyncMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "records_fetched", nullable = false)
    private int fetched;

    @Column(name = "records_created", nullable = false)
    private int created;

    @Column(name = "records_updated", nullable = false)
    private int updated;

    @Column(name = "records_failed", nullable = false)
    private int failed;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }

    public boolean isSealed() {
        return status == RunStatus.COMPLETED || status == RunStatus.FAILED;
    }

    public void markAsStarted(Instant now, String correlationId) {
        this.status = RunStatus.STARTED;
        this.startedAt = now;
        this.correlationId = correlationId;
    }

    public void markAsCompleted(Instant now, int fetched, int created, int updated, int failed) {
        requireOpen();
        this.status = RunStatus.COMPLETED;
        this.completedAt = now;
        this.fetched = fetched;
        this.created = created;
        this.updated = updated;
        this.failed = failed;
    }

    /**
     * Counts are whatever the run managed before it aborted.
     */
    public void markAsFailed(Instant now, int fetched, int created, int updated, int failed, String errorMessage) {
        requireOpen();
        this.status = RunStatus.FAILED;
        this.completedAt = now;
        this.fetched = fetched;
        this.created = created;
        this.updated = updated;
        this.failed = failed;
        this.errorMessage = errorMessage;
    }

    private void requireOpen() {
        if (isSealed()) {
            throw new IllegalStateException("SyncRun " + id + " is already sealed as " + status);
        }
    }

    public enum RunStatus {
        STARTED,
        COMPLETED,
        FAILED
    }
}
