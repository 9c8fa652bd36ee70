package com.example.pipelinesync.service.mirror;

import com.example.pipelinesync.client.ApiResponse;
import com.example.pipelinesync.client.target.TargetApiClient;
import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.exception.FetchAbortedException;
import com.example.pipelinesync.exception.RecordValidationException;
import com.example.pipelinesync.exception.RemoteServiceException;
import com.example.pipelinesync.repository.TargetOpportunityRepository;
import com.example.pipelinesync.service.mapper.TargetOpportunityMapper;
import com.example.pipelinesync.service.pipeline.PipelineCatalog;
import com.example.pipelinesync.service.pipeline.StageGraph;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Pulls the opportunities of every configured pipeline from Target into the local mirror.
 * This is how manual edits made in Target reach local state.
 *
 * Rows are matched by Target id. The local {@code lastTransitionAt} is never overwritten
 * from Target; it only records transitions this service applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TargetOpportunitySyncService implements SyncTask {

    public static final String ENTITY_NAME = "target-opportunities";

    private final TargetApiClient targetApiClient;
    private final TargetOpportunityRepository opportunityRepository;
    private final TargetOpportunityMapper mapper;
    private final PipelineCatalog pipelineCatalog;
    private final EntityLock entityLock;
    private final Clock clock;

    @Override
    public String name() {
        return ENTITY_NAME;
    }

    /**
     * Always a full walk of each pipeline; {@code mode} and {@code since} do not narrow it.
     */
    @Override
    public SyncStats run(SyncMode mode, Instant since) {
        return entityLock.runLocked(ENTITY_NAME, this::syncAllPipelines);
    }

    /**
     * Refresh one opportunity from a Target payload.
     *
     * @return the persisted mirror row
     * @throws RecordValidationException when the payload is unusable or names a stage
     *                                   its pipeline does not define
     */
    public TargetOpportunity refreshFromRemote(JsonNode raw) {
        return upsert(mapper.map(raw), clock.instant()).opportunity();
    }

    private SyncStats syncAllPipelines() {
        SyncStats stats = new SyncStats();
        for (StageGraph graph : pipelineCatalog.all()) {
            try {
                syncPipeline(graph, stats);
            } catch (RuntimeException e) {
                log.error("Opportunity sync aborted: pipeline={}, {}: {}", graph.getKey(), stats, e.getMessage());
                throw new FetchAbortedException(ENTITY_NAME, stats.snapshot(), e);
            }
        }
        log.info("Completed opportunity sync: pipelines={}, {}", pipelineCatalog.all().size(), stats);
        return stats;
    }

    private void syncPipeline(StageGraph graph, SyncStats stats) {
        int page = 1;
        while (true) {
            ApiResponse response = targetApiClient.searchOpportunities(graph.getPipelineId(), page);
            if (!response.isSuccessful()) {
                throw new RemoteServiceException(String.format("Opportunity search failed: pipeline=%s page=%d status=%d",
                        graph.getKey(), page, response.getStatus()), response.getStatus());
            }

            JsonNode body = targetApiClient.readBody(response);
            JsonNode opportunities = body.path("opportunities");
            if (!opportunities.isArray() || opportunities.isEmpty()) {
                break;
            }

            stats.addFetched(opportunities.size());
            Instant fetchedAt = clock.instant();
            for (JsonNode raw : opportunities) {
                try {
                    stats.recordUpsert(upsert(mapper.map(raw), fetchedAt).inserted());
                } catch (RecordValidationException | DataAccessException e) {
                    stats.recordFailure();
                    log.warn("Failed to mirror opportunity: pipeline={}, targetId={}, error={}",
                            graph.getKey(), Objects.toString(raw.get("id"), "?"), e.getMessage());
                }
            }
            log.info("entity={} pipeline={} page={} fetched={} total={}",
                    ENTITY_NAME, graph.getKey(), page, opportunities.size(), stats.getFetched());

            JsonNode nextPage = body.path("meta").path("nextPage");
            if (!nextPage.canConvertToInt() || nextPage.asInt() <= page) {
                break;
            }
            page = nextPage.asInt();
        }
    }

    private Upserted upsert(TargetOpportunity incoming, Instant fetchedAt) {
        Optional<StageGraph> graph = pipelineCatalog.byPipelineId(incoming.getPipelineId());
        if (graph.isPresent() && !graph.get().contains(incoming.getStageId())) {
            throw new RecordValidationException(String.format("Opportunity %s is in unknown stage %s of pipeline %s",
                    incoming.getTargetId(), incoming.getStageId(), graph.get().getKey()));
        }

        Optional<TargetOpportunity> existing = opportunityRepository.findByTargetId(incoming.getTargetId());
        TargetOpportunity row = existing.orElse(incoming);
        if (existing.isPresent()) {
            row.setPipelineId(incoming.getPipelineId());
            row.setStageId(incoming.getStageId());
            row.setName(incoming.getName());
            row.setMonetaryValue(incoming.getMonetaryValue());
            row.setStatus(incoming.getStatus());
            row.setLinkedSourceCustomerId(incoming.getLinkedSourceCustomerId());
            row.setLinkedSourceJobId(incoming.getLinkedSourceJobId());
            row.setRawPayload(incoming.getRawPayload());
        }
        row.setFetchedAt(fetchedAt);
        return new Upserted(opportunityRepository.save(row), existing.isEmpty());
    }

    private record Upserted(TargetOpportunity opportunity, boolean inserted) {
    }
}
