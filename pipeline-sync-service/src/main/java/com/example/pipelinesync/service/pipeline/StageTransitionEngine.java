package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.client.ApiResponse;
import com.example.pipelinesync.client.target.OpportunityUpdate;
import com.example.pipelinesync.client.target.TargetApiClient;
import com.example.pipelinesync.config.PipelineProperties;
import com.example.pipelinesync.config.TargetApiProperties;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.exception.RemoteServiceException;
import com.example.pipelinesync.exception.ResourceNotFoundException;
import com.example.pipelinesync.metrics.SyncMetrics;
import com.example.pipelinesync.repository.TargetOpportunityRepository;
import com.example.pipelinesync.service.mirror.TargetOpportunitySyncService;
import com.example.pipelinesync.service.pipeline.TransitionBatchResult.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Polling detector and idempotent applier for pipeline stage transitions.
 *
 * FLOW (per candidate):
 * 1. Optionally read the opportunity from Target, refresh the local mirror, and skip it
 *    when it no longer sits in the transition's source stages (manual edit, other pipeline)
 * 2. PUT the new pipeline/stage (and derived fields) through the rate-limited client
 * 3. Only after a 2xx, write the new stage and lastTransitionAt to the local mirror
 *
 * One candidate's failure never stops the batch. A failed candidate keeps its old local
 * stage, so the next detection pass finds it again.
 */
@Service
@Slf4j
public class StageTransitionEngine {

    private final List<TransitionRule> rules;
    private final TargetApiClient targetApiClient;
    private final TargetOpportunityRepository opportunityRepository;
    private final TargetOpportunitySyncService opportunitySyncService;
    private final PipelineProperties pipelineProperties;
    private final TargetApiProperties targetProperties;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    public StageTransitionEngine(List<TransitionRule> rules,
                                 TargetApiClient targetApiClient,
                                 TargetOpportunityRepository opportunityRepository,
                                 TargetOpportunitySyncService opportunitySyncService,
                                 PipelineProperties pipelineProperties,
                                 TargetApiProperties targetProperties,
                                 SyncMetrics syncMetrics,
                                 Clock clock) {
        this.rules = rules.stream().sorted(Comparator.comparing(TransitionRule::type)).toList();
        this.targetApiClient = targetApiClient;
        this.opportunityRepository = opportunityRepository;
        this.opportunitySyncService = opportunitySyncService;
        this.pipelineProperties = pipelineProperties;
        this.targetProperties = targetProperties;
        this.syncMetrics = syncMetrics;
        this.clock = clock;
    }

    /**
     * Run every transition type in order. A record advanced by one type may be picked up
     * by the next one in the same batch.
     */
    public Map<TransitionType, TransitionBatchResult> runAll(boolean dryRun) {
        boolean ownsCorrelationId = MDC.get("correlationId") == null;
        if (ownsCorrelationId) {
            MDC.put("correlationId", "TRANSITION-" + UUID.randomUUID().toString().substring(0, 8));
        }
        try {
            Map<TransitionType, TransitionBatchResult> results = new EnumMap<>(TransitionType.class);
            for (TransitionRule rule : rules) {
                results.put(rule.type(), run(rule, dryRun));
            }
            return results;
        } finally {
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }

    public TransitionBatchResult run(TransitionType type, boolean dryRun) {
        TransitionRule rule = rules.stream()
                .filter(r -> r.type() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No rule registered for " + type));
        return run(rule, dryRun);
    }

    private TransitionBatchResult run(TransitionRule rule, boolean dryRun) {
        TransitionBatchResult result = new TransitionBatchResult(rule.type(), dryRun);

        List<TransitionCandidate> candidates = rule.detect();
        int limit = pipelineProperties.getTransitions().getBatchLimit();
        if (candidates.size() > limit) {
            log.warn("Transition batch truncated: type={}, detected={}, limit={}", rule.type(), candidates.size(), limit);
            candidates = candidates.subList(0, limit);
        }
        result.addDetected(candidates.size());
        log.info("Detected transitions: type={}, count={}, dryRun={}", rule.type(), candidates.size(), dryRun);

        for (TransitionCandidate candidate : candidates) {
            if (dryRun) {
                log.info("Dry run: would transition type={} targetId={} from={}/{} to={}/{} reason={}",
                        candidate.type(), candidate.opportunity().getTargetId(),
                        candidate.opportunity().getPipelineId(), candidate.opportunity().getStageId(),
                        candidate.destination().getKey(), candidate.destinationRole(), candidate.reason());
                continue;
            }
            Outcome outcome = applySafely(rule, candidate);
            result.record(outcome);
            syncMetrics.recordTransition(rule.type().metricTag(), outcome.metricTag());
        }

        log.info("Finished transitions: {}", result);
        return result;
    }

    private Outcome applySafely(TransitionRule rule, TransitionCandidate candidate) {
        String targetId = candidate.opportunity().getTargetId();
        try {
            return apply(rule, candidate);
        } catch (ResourceNotFoundException e) {
            log.warn("Transition skipped, opportunity gone: type={}, targetId={}", candidate.type(), targetId);
            return Outcome.NOT_FOUND;
        } catch (RuntimeException e) {
            log.error("Transition failed: type={}, targetId={}, reason={}, error={}",
                    candidate.type(), targetId, candidate.reason(), e.getMessage());
            return Outcome.FAILED;
        }
    }

    private Outcome apply(TransitionRule rule, TransitionCandidate candidate) {
        String targetId = candidate.opportunity().getTargetId();

        if (pipelineProperties.getTransitions().isVerifyRemoteStage()) {
            TargetOpportunity remote = fetchRemote(targetId);
            if (!rule.isEligible(remote)) {
                log.info("Transition skipped, remote state moved: type={}, targetId={}, remote={}/{}",
                        candidate.type(), targetId, remote.getPipelineId(), remote.getStageId());
                return Outcome.SKIPPED;
            }
        }

        ApiResponse response = targetApiClient.updateOpportunity(targetId, toUpdate(candidate));
        if (response.isNotFound()) {
            throw ResourceNotFoundException.opportunity(targetId);
        }
        if (!response.isSuccessful()) {
            throw new RemoteServiceException(String.format("Target rejected transition of %s: status=%d body=%s",
                    targetId, response.getStatus(), response.getBody()), response.getStatus());
        }

        TargetOpportunity local = opportunityRepository.findByTargetId(targetId).orElse(candidate.opportunity());
        local.applyTransition(candidate.destination().getPipelineId(), candidate.destinationStageId(),
                candidate.name(), candidate.monetaryValue(), candidate.linkedSourceJobId(), clock.instant());
        opportunityRepository.save(local);

        log.info("Transition applied: type={}, targetId={}, to={}/{}, reason={}",
                candidate.type(), targetId, candidate.destination().getKey(), candidate.destinationRole(),
                candidate.reason());
        return Outcome.APPLIED;
    }

    private TargetOpportunity fetchRemote(String targetId) {
        ApiResponse response = targetApiClient.getOpportunity(targetId);
        if (response.isNotFound()) {
            throw ResourceNotFoundException.opportunity(targetId);
        }
        if (!response.isSuccessful()) {
            throw new RemoteServiceException(String.format("Could not read opportunity %s: status=%d",
                    targetId, response.getStatus()), response.getStatus());
        }
        return opportunitySyncService.refreshFromRemote(targetApiClient.readBody(response));
    }

    private OpportunityUpdate toUpdate(TransitionCandidate candidate) {
        OpportunityUpdate.OpportunityUpdateBuilder update = OpportunityUpdate.builder()
                .pipelineId(candidate.destination().getPipelineId())
                .pipelineStageId(candidate.destinationStageId())
                .name(candidate.name())
                .monetaryValue(candidate.monetaryValue());
        String jobField = targetProperties.getCustomFields().getSourceJobId();
        if (candidate.linkedSourceJobId() != null && jobField != null) {
            update.customField(new OpportunityUpdate.CustomFieldValue(jobField,
                    String.valueOf(candidate.linkedSourceJobId())));
        }
        return update.build();
    }
}
