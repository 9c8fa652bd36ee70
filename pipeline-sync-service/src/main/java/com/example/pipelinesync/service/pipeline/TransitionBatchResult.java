package com.example.pipelinesync.service.pipeline;

import lombok.Getter;

import java.util.Locale;

/**
 * Outcome counts of one transition type within a batch.
 * In a dry run nothing is applied; every detected candidate is only logged.
 */
@Getter
public class TransitionBatchResult {

    private final TransitionType type;
    private final boolean dryRun;
    private int detected;
    private int applied;
    private int skipped;
    private int notFound;
    private int failed;

    public TransitionBatchResult(TransitionType type, boolean dryRun) {
        this.type = type;
        this.dryRun = dryRun;
    }

    void addDetected(int count) {
        detected += count;
    }

    void record(Outcome outcome) {
        switch (outcome) {
            case APPLIED -> applied++;
            case SKIPPED -> skipped++;
            case NOT_FOUND -> notFound++;
            case FAILED -> failed++;
        }
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    @Override
    public String toString() {
        return String.format("type=%s detected=%d applied=%d skipped=%d notFound=%d failed=%d dryRun=%s",
                type, detected, applied, skipped, notFound, failed, dryRun);
    }

    enum Outcome {
        APPLIED,
        SKIPPED,
        NOT_FOUND,
        FAILED;

        String metricTag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
