package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.entity.JobRecord;

import java.time.Instant;
import java.util.Comparator;

/**
 * Orderings for choosing one install job when a customer has several new ones.
 * Ties after the configured list fall back to the lowest source id.
 */
public enum InstallJobPriority {

    NEWEST_CREATED(Comparator.comparing(JobRecord::getSourceCreatedOn,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))),

    OLDEST_CREATED(Comparator.comparing(JobRecord::getSourceCreatedOn,
            Comparator.nullsLast(Comparator.<Instant>naturalOrder()))),

    LOWEST_SOURCE_ID(Comparator.comparing(JobRecord::getSourceId));

    private final Comparator<JobRecord> comparator;

    InstallJobPriority(Comparator<JobRecord> comparator) {
        this.comparator = comparator;
    }

    public static Comparator<JobRecord> chain(Iterable<InstallJobPriority> priorities) {
        Comparator<JobRecord> chained = (a, b) -> 0;
        for (InstallJobPriority priority : priorities) {
            chained = chained.thenComparing(priority.comparator);
        }
        return chained.thenComparing(LOWEST_SOURCE_ID.comparator);
    }
}
