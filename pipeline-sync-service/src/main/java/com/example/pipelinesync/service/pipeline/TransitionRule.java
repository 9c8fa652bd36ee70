package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.entity.TargetOpportunity;

import java.util.List;

/**
 * Detection half of one transition.
 */
public interface TransitionRule {

    TransitionType type();

    /**
     * Candidates from current mirrored state, at most one per opportunity, ordered by Target id.
     */
    List<TransitionCandidate> detect();

    /**
     * Whether an opportunity, as Target currently reports it, still sits in this
     * transition's source stages. Used to re-check a candidate against remote state.
     */
    boolean isEligible(TargetOpportunity opportunity);
}
