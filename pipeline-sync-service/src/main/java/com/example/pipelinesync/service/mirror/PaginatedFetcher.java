package com.example.pipelinesync.service.mirror;

import com.example.pipelinesync.client.source.SourceApiClient;
import com.example.pipelinesync.client.source.SourcePage;
import com.example.pipelinesync.config.MirrorSyncProperties;
import com.example.pipelinesync.config.SourceApiProperties;
import com.example.pipelinesync.entity.MirroredEntity;
import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.exception.FetchAbortedException;
import com.example.pipelinesync.exception.RecordValidationException;
import com.example.pipelinesync.repository.MirrorUpsertRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entity-agnostic pull-and-upsert loop against a Source collection.
 *
 * FLOW (per page, strictly sequential):
 * 1. Fetch the page (retries live in the client)
 * 2. Map and upsert every record; a bad record is counted as failed, the page continues
 * 3. Persist the cursor (full mode) only once the page's upserts have committed
 * 4. Pause before the next page
 *
 * Any fetch-level error aborts the run with {@link FetchAbortedException}; what was
 * committed stays, and the next run resumes from the last persisted cursor.
 */
@Slf4j
public class PaginatedFetcher<E extends MirroredEntity> implements SyncTask {

    private final MirrorDefinition<E> definition;
    private final SourceApiClient sourceApiClient;
    private final MirrorUpsertRepository upsertRepository;
    private final SyncCursorService cursorService;
    private final EntityLock entityLock;
    private final SourceApiProperties sourceProperties;
    private final MirrorSyncProperties mirrorProperties;
    private final Clock clock;

    public PaginatedFetcher(MirrorDefinition<E> definition,
                            SourceApiClient sourceApiClient,
                            MirrorUpsertRepository upsertRepository,
                            SyncCursorService cursorService,
                            EntityLock entityLock,
                            SourceApiProperties sourceProperties,
                            MirrorSyncProperties mirrorProperties,
                            Clock clock) {
        this.definition = definition;
        this.sourceApiClient = sourceApiClient;
        this.upsertRepository = upsertRepository;
        this.cursorService = cursorService;
        this.entityLock = entityLock;
        this.sourceProperties = sourceProperties;
        this.mirrorProperties = mirrorProperties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return definition.getEntityName();
    }

    @Override
    public SyncStats run(SyncMode mode, Instant since) {
        return entityLock.runLocked(name(), () -> mode == SyncMode.FULL ? runFull() : runIncremental(since));
    }

    private SyncStats runIncremental(Instant since) {
        Instant runStartedAt = clock.instant();
        Instant from = since != null
                ? since
                : cursorService.incrementalWatermark(name())
                        .orElseGet(() -> runStartedAt.minus(mirrorProperties.getLookback()));

        log.info("Starting incremental fetch: entity={}, modifiedOnOrAfter={}", name(), from);
        SyncStats stats = new SyncStats();
        int page = 1;
        try {
            while (true) {
                Map<String, String> query = new LinkedHashMap<>();
                query.put("page", String.valueOf(page));
                query.put("pageSize", String.valueOf(sourceProperties.getPageSize()));
                query.put("modifiedOnOrAfter", from.toString());

                SourcePage result = sourceApiClient.fetchPage(definition.getListPath(), query);
                if (result.isEmpty()) {
                    break;
                }
                upsertPage(result, stats);
                log.info("entity={} mode=incremental page={} fetched={} total={}",
                        name(), page, result.getData().size(), stats.getFetched());
                if (!result.isHasMore()) {
                    break;
                }
                page++;
                pause();
            }
            // Only a completed walk advances the watermark; an aborted run retries the same window.
            cursorService.save(name(), SyncMode.INCREMENTAL, runStartedAt.toString());
        } catch (RuntimeException e) {
            log.error("Incremental fetch aborted: entity={}, page={}, {}: {}", name(), page, stats, e.getMessage());
            throw new FetchAbortedException(name(), stats.snapshot(), e);
        }

        log.info("Completed incremental fetch: entity={}, pages={}, {}", name(), page, stats);
        return stats;
    }

    private SyncStats runFull() {
        String token = cursorService.find(name(), SyncMode.FULL).orElse(null);
        log.info("Starting full fetch: entity={}, resumeFrom={}", name(), token != null ? "cursor" : "start");

        SyncStats stats = new SyncStats();
        int page = 0;
        try {
            boolean hasMore = true;
            while (hasMore) {
                Map<String, String> query = new LinkedHashMap<>();
                if (token != null) {
                    query.put("from", token);
                }

                SourcePage result = sourceApiClient.fetchPage(definition.getExportPath(), query);
                page++;
                upsertPage(result, stats);

                String next = result.getContinueFrom();
                boolean advanced = next != null && !next.equals(token);
                if (advanced) {
                    cursorService.save(name(), SyncMode.FULL, next);
                    token = next;
                }
                log.info("entity={} mode=full page={} fetched={} total={}",
                        name(), page, result.isEmpty() ? 0 : result.getData().size(), stats.getFetched());

                if (result.isHasMore() && !advanced) {
                    // Re-requesting the same continuation would return the same page forever.
                    log.warn("Full fetch stopped on non-advancing cursor: entity={}, page={}, continueFrom={}",
                            name(), page, next);
                }
                hasMore = result.isHasMore() && advanced;
                if (hasMore) {
                    pause();
                }
            }
        } catch (RuntimeException e) {
            log.error("Full fetch aborted: entity={}, page={}, {}: {}", name(), page + 1, stats, e.getMessage());
            throw new FetchAbortedException(name(), stats.snapshot(), e);
        }

        log.info("Completed full fetch: entity={}, pages={}, {}", name(), page, stats);
        return stats;
    }

    private void upsertPage(SourcePage page, SyncStats stats) {
        if (page.isEmpty()) {
            return;
        }
        stats.addFetched(page.getData().size());
        Instant fetchedAt = clock.instant();

        for (JsonNode raw : page.getData()) {
            try {
                E record = definition.getMapper().map(raw);
                record.setTenantId(sourceProperties.getTenantId());
                record.setRawPayload(raw.toString());
                record.setFetchedAt(fetchedAt);
                stats.recordUpsert(upsertRepository.upsert(definition.getTable(), record));
            } catch (RecordValidationException | DataAccessException e) {
                stats.recordFailure();
                log.warn("Failed to upsert record: entity={}, sourceId={}, error={}",
                        name(), Objects.toString(raw.get("id"), "?"), e.getMessage());
            }
        }
    }

    private void pause() {
        Duration delay = sourceProperties.getPageDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between pages of " + name(), e);
        }
    }
}
