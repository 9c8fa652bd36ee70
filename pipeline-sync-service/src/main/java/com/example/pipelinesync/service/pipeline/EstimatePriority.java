package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.entity.EstimateRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;

/**
 * Orderings for choosing one sold estimate when a customer has several.
 * Configured as a list; ties after the list fall back to the lowest source id.
 */
public enum EstimatePriority {

    MOST_RECENTLY_SOLD(Comparator.comparing(EstimateRecord::getSoldOn,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))),

    HIGHEST_TOTAL(Comparator.comparing(EstimateRecord::getTotal,
            Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()))),

    LOWEST_SOURCE_ID(Comparator.comparing(EstimateRecord::getSourceId));

    private final Comparator<EstimateRecord> comparator;

    EstimatePriority(Comparator<EstimateRecord> comparator) {
        this.comparator = comparator;
    }

    public static Comparator<EstimateRecord> chain(Iterable<EstimatePriority> priorities) {
        Comparator<EstimateRecord> chained = (a, b) -> 0;
        for (EstimatePriority priority : priorities) {
            chained = chained.thenComparing(priority.comparator);
        }
        return chained.thenComparing(LOWEST_SOURCE_ID.comparator);
    }
}
