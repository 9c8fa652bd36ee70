package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.config.PipelineProperties;
import com.example.pipelinesync.config.SourceApiProperties;
import com.example.pipelinesync.entity.CustomerRecord;
import com.example.pipelinesync.entity.EstimateRecord;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.entity.TargetOpportunity.OpportunityStatus;
import com.example.pipelinesync.repository.CustomerRecordRepository;
import com.example.pipelinesync.repository.TargetOpportunityRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Open sales opportunity at or before "proposal sent" whose customer has a sold estimate
 * moves to "job sold", taking the estimate's total and a name built from it.
 */
@Component
@RequiredArgsConstructor
public class SoldTransitionRule implements TransitionRule {

    private final TargetOpportunityRepository opportunityRepository;
    private final CustomerRecordRepository customerRepository;
    private final PipelineCatalog pipelineCatalog;
    private final PipelineProperties pipelineProperties;
    private final SourceApiProperties sourceProperties;

    @Override
    public TransitionType type() {
        return TransitionType.SOLD;
    }

    @Override
    public List<TransitionCandidate> detect() {
        StageGraph sales = pipelineCatalog.sales();
        List<Object[]> rows = opportunityRepository.findSoldCandidates(sales.getPipelineId(),
                sales.stageIdsAtOrBefore(StageRole.PROPOSAL_SENT), OpportunityStatus.OPEN,
                sourceProperties.getTenantId(), EstimateRecord.STATUS_SOLD);

        Map<String, TargetOpportunity> opportunities = new LinkedHashMap<>();
        Map<String, List<EstimateRecord>> estimates = new LinkedHashMap<>();
        for (Object[] row : rows) {
            TargetOpportunity opportunity = (TargetOpportunity) row[0];
            opportunities.putIfAbsent(opportunity.getTargetId(), opportunity);
            estimates.computeIfAbsent(opportunity.getTargetId(), id -> new ArrayList<>()).add((EstimateRecord) row[1]);
        }

        Comparator<EstimateRecord> priority = EstimatePriority.chain(
                pipelineProperties.getTransitions().getEstimatePriority());
        List<TransitionCandidate> candidates = new ArrayList<>();
        opportunities.forEach((targetId, opportunity) -> {
            EstimateRecord estimate = estimates.get(targetId).stream().min(priority).orElseThrow();
            candidates.add(new TransitionCandidate(
                    TransitionType.SOLD,
                    opportunity,
                    sales,
                    StageRole.JOB_SOLD,
                    OpportunityNames.forEstimate(customerName(estimate.getCustomerId()), estimate),
                    estimate.getTotal(),
                    null,
                    "estimate=" + estimate.getSourceId()));
        });
        return candidates;
    }

    @Override
    public boolean isEligible(TargetOpportunity opportunity) {
        StageGraph sales = pipelineCatalog.sales();
        return sales.getPipelineId().equals(opportunity.getPipelineId())
                && opportunity.getStatus() == OpportunityStatus.OPEN
                && sales.stageIdsAtOrBefore(StageRole.PROPOSAL_SENT).contains(opportunity.getStageId());
    }

    private String customerName(Long customerId) {
        return customerRepository.findByTenantIdAndSourceId(sourceProperties.getTenantId(), customerId)
                .map(CustomerRecord::getName)
                .orElse(null);
    }
}
