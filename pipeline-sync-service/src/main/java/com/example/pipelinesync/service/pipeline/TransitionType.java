package com.example.pipelinesync.service.pipeline;

import java.util.Locale;

/**
 * Named transitions, in the order a batch runs them.
 */
public enum TransitionType {
    /** Sold estimate moves a sales opportunity to "job sold". */
    SOLD,
    /** New install job moves a sold opportunity into the install pipeline. */
    INSTALL_STARTED,
    /** Active appointment moves an install opportunity to "in progress". */
    IN_PROGRESS;

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
