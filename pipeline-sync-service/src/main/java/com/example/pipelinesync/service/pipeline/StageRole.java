package com.example.pipelinesync.service.pipeline;

/**
 * Semantic stage labels. Transitions refer to roles, never to raw stage ids.
 */
public enum StageRole {
    // Sales pipeline
    NEW_LEAD,
    CONTACTED,
    APPOINTMENT_SCHEDULED,
    PROPOSAL_SENT,
    ESTIMATE_FOLLOW_UP,
    JOB_SOLD,
    ESTIMATE_LOST,

    // Install pipeline
    JOB_CREATED,
    PLANNING,
    SCHEDULED,
    IN_PROGRESS,
    ON_HOLD,
    COMPLETED
}
