package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.config.PipelineProperties;
import com.example.pipelinesync.config.SourceApiProperties;
import com.example.pipelinesync.entity.CustomerRecord;
import com.example.pipelinesync.entity.JobRecord;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.entity.TargetOpportunity.OpportunityStatus;
import com.example.pipelinesync.repository.CustomerRecordRepository;
import com.example.pipelinesync.repository.TargetOpportunityRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Opportunity exactly at "job sold" whose customer has a newly created install job moves
 * into the install pipeline at "job created" and is re-linked to that job.
 *
 * An install job is one whose business unit name contains a configured fragment
 * (case-insensitive), created within the configured window.
 */
@Component
@RequiredArgsConstructor
public class InstallStartedTransitionRule implements TransitionRule {

    private static final Set<OpportunityStatus> ELIGIBLE_STATUSES = EnumSet.of(OpportunityStatus.OPEN, OpportunityStatus.WON);

    private final TargetOpportunityRepository opportunityRepository;
    private final CustomerRecordRepository customerRepository;
    private final PipelineCatalog pipelineCatalog;
    private final PipelineProperties pipelineProperties;
    private final SourceApiProperties sourceProperties;
    private final Clock clock;

    @Override
    public TransitionType type() {
        return TransitionType.INSTALL_STARTED;
    }

    @Override
    public List<TransitionCandidate> detect() {
        PipelineProperties.Transitions settings = pipelineProperties.getTransitions();
        StageGraph sales = pipelineCatalog.sales();
        StageGraph install = pipelineCatalog.install();
        Instant createdAfter = clock.instant().minus(settings.getInstallJobWindow());

        List<Object[]> rows = opportunityRepository.findInstallCandidates(sales.getPipelineId(),
                sales.stage(StageRole.JOB_SOLD).id(), ELIGIBLE_STATUSES, sourceProperties.getTenantId(),
                createdAfter, install.getPipelineId());

        Map<String, TargetOpportunity> opportunities = new LinkedHashMap<>();
        Map<String, List<JobRecord>> jobs = new LinkedHashMap<>();
        for (Object[] row : rows) {
            if (!isInstallUnit((String) row[2], settings.getInstallBusinessUnits())) {
                continue;
            }
            TargetOpportunity opportunity = (TargetOpportunity) row[0];
            opportunities.putIfAbsent(opportunity.getTargetId(), opportunity);
            jobs.computeIfAbsent(opportunity.getTargetId(), id -> new ArrayList<>()).add((JobRecord) row[1]);
        }

        Comparator<JobRecord> priority = InstallJobPriority.chain(settings.getInstallJobPriority());
        List<TransitionCandidate> candidates = new ArrayList<>();
        opportunities.forEach((targetId, opportunity) -> {
            JobRecord job = jobs.get(targetId).stream().min(priority).orElseThrow();
            candidates.add(new TransitionCandidate(
                    TransitionType.INSTALL_STARTED,
                    opportunity,
                    install,
                    StageRole.JOB_CREATED,
                    OpportunityNames.forJob(customerName(job.getCustomerId()), job),
                    null,
                    job.getSourceId(),
                    "job=" + job.getSourceId()));
        });
        return candidates;
    }

    @Override
    public boolean isEligible(TargetOpportunity opportunity) {
        StageGraph sales = pipelineCatalog.sales();
        return sales.getPipelineId().equals(opportunity.getPipelineId())
                && ELIGIBLE_STATUSES.contains(opportunity.getStatus())
                && sales.stage(StageRole.JOB_SOLD).id().equals(opportunity.getStageId());
    }

    static boolean isInstallUnit(String businessUnitName, List<String> fragments) {
        if (businessUnitName == null) {
            return false;
        }
        String name = businessUnitName.toLowerCase(Locale.ROOT);
        return fragments.stream()
                .filter(fragment -> fragment != null && !fragment.isBlank())
                .anyMatch(fragment -> name.contains(fragment.toLowerCase(Locale.ROOT)));
    }

    private String customerName(Long customerId) {
        return customerRepository.findByTenantIdAndSourceId(sourceProperties.getTenantId(), customerId)
                .map(CustomerRecord::getName)
                .orElse(null);
    }
}
