package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.entity.EstimateRecord;
import com.example.pipelinesync.entity.JobRecord;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Display names written to Target opportunities, e.g. {@code "Jane Doe - Roof Replacement - $12,500.5"}.
 */
final class OpportunityNames {

    private static final String SEPARATOR = " - ";

    private OpportunityNames() {
    }

    static String forEstimate(String customerName, EstimateRecord estimate) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, customerName);
        addIfPresent(parts, estimate.getName());
        if (estimate.getTotal() != null && estimate.getTotal().signum() > 0) {
            parts.add(money(estimate.getTotal()));
        }
        return parts.isEmpty() ? "Estimate #" + estimate.getSourceId() : String.join(SEPARATOR, parts);
    }

    static String forJob(String customerName, JobRecord job) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, customerName);
        addIfPresent(parts, job.getSummary());
        if (parts.size() < 2 && job.getJobNumber() != null) {
            parts.add("Job #" + job.getJobNumber());
        }
        return parts.isEmpty() ? "Job #" + job.getSourceId() : String.join(SEPARATOR, parts);
    }

    static String money(BigDecimal amount) {
        // DecimalFormat is not thread-safe
        DecimalFormat format = new DecimalFormat("$#,##0.##", DecimalFormatSymbols.getInstance(Locale.US));
        return format.format(amount);
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }
}
