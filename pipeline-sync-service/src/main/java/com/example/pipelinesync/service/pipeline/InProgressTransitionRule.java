package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.config.PipelineProperties;
import com.example.pipelinesync.config.SourceApiProperties;
import com.example.pipelinesync.entity.AppointmentRecord;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.entity.TargetOpportunity.OpportunityStatus;
import com.example.pipelinesync.repository.TargetOpportunityRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Open install opportunity at "job created", "planning" or "scheduled" whose linked job
 * has an active appointment moves to "in progress".
 */
@Component
@RequiredArgsConstructor
public class InProgressTransitionRule implements TransitionRule {

    private static final Set<StageRole> SOURCE_ROLES = EnumSet.of(
            StageRole.JOB_CREATED, StageRole.PLANNING, StageRole.SCHEDULED);

    private final TargetOpportunityRepository opportunityRepository;
    private final PipelineCatalog pipelineCatalog;
    private final PipelineProperties pipelineProperties;
    private final SourceApiProperties sourceProperties;

    @Override
    public TransitionType type() {
        return TransitionType.IN_PROGRESS;
    }

    @Override
    public List<TransitionCandidate> detect() {
        StageGraph install = pipelineCatalog.install();
        List<String> sourceStages = sourceStages(install);
        List<String> activeStatuses = pipelineProperties.getTransitions().getActiveAppointmentStatuses().stream()
                .map(status -> status.toLowerCase(Locale.ROOT))
                .toList();
        if (sourceStages.isEmpty() || activeStatuses.isEmpty()) {
            return List.of();
        }

        List<Object[]> rows = opportunityRepository.findInProgressCandidates(install.getPipelineId(),
                sourceStages, OpportunityStatus.OPEN, sourceProperties.getTenantId(), activeStatuses);

        // Rows are ordered by appointment id within an opportunity; the first one is reported.
        Map<String, TransitionCandidate> candidates = new LinkedHashMap<>();
        for (Object[] row : rows) {
            TargetOpportunity opportunity = (TargetOpportunity) row[0];
            AppointmentRecord appointment = (AppointmentRecord) row[1];
            candidates.putIfAbsent(opportunity.getTargetId(), new TransitionCandidate(
                    TransitionType.IN_PROGRESS,
                    opportunity,
                    install,
                    StageRole.IN_PROGRESS,
                    null,
                    null,
                    null,
                    "appointment=" + appointment.getSourceId() + " status=" + appointment.getStatus()));
        }
        return new ArrayList<>(candidates.values());
    }

    @Override
    public boolean isEligible(TargetOpportunity opportunity) {
        StageGraph install = pipelineCatalog.install();
        return install.getPipelineId().equals(opportunity.getPipelineId())
                && opportunity.getStatus() == OpportunityStatus.OPEN
                && sourceStages(install).contains(opportunity.getStageId());
    }

    private static List<String> sourceStages(StageGraph install) {
        return install.stageIds(SOURCE_ROLES).stream()
                .filter(stageId -> !install.isAtOrPast(stageId, StageRole.IN_PROGRESS))
                .toList();
    }
}
