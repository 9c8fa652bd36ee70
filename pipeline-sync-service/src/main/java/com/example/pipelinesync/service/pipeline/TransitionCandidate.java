package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.entity.TargetOpportunity;

import java.math.BigDecimal;

/**
 * One detected transition, not yet applied.
 *
 * @param name              new display name, {@code null} to keep the current one
 * @param monetaryValue     new value, {@code null} to keep the current one
 * @param linkedSourceJobId job to re-link to, {@code null} to keep the current link
 * @param reason            Source fact that justified the transition, for logs
 */
public record TransitionCandidate(
        TransitionType type,
        TargetOpportunity opportunity,
        StageGraph destination,
        StageRole destinationRole,
        String name,
        BigDecimal monetaryValue,
        Long linkedSourceJobId,
        String reason) {

    public String destinationStageId() {
        return destination.stage(destinationRole).id();
    }
}
