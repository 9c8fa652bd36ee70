package com.example.pipelinesync.service.mirror;

import com.example.pipelinesync.entity.SyncCursor;
import com.example.pipelinesync.entity.SyncMode;
import com.example.pipelinesync.repository.SyncCursorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads and persists resume points. Each save is its own short transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncCursorService {

    private final SyncCursorRepository syncCursorRepository;

    @Transactional(readOnly = true)
    public Optional<String> find(String entityName, SyncMode mode) {
        return syncCursorRepository.findByEntityNameAndMode(entityName, mode)
                .map(SyncCursor::getCursorValue)
                .filter(value -> !value.isBlank());
    }

    /**
     * Stored incremental watermark. An unreadable value is ignored so the run falls back to the lookback window.
     */
    @Transactional(readOnly = true)
    public Optional<Instant> incrementalWatermark(String entityName) {
        return find(entityName, SyncMode.INCREMENTAL).flatMap(value -> {
            try {
                return Optional.of(Instant.parse(value));
            } catch (DateTimeParseException e) {
                log.warn("Ignoring unreadable incremental cursor: entity={}, value={}", entityName, value);
                return Optional.empty();
            }
        });
    }

    @Transactional
    public void save(String entityName, SyncMode mode, String value) {
        SyncCursor cursor = syncCursorRepository.findByEntityNameAndMode(entityName, mode)
                .orElseGet(() -> SyncCursor.builder()
                        .entityName(entityName)
                        .mode(mode)
                        .build());
        cursor.setCursorValue(value);
        syncCursorRepository.save(cursor);
        log.debug("Saved cursor: entity={}, mode={}, value={}", entityName, mode, value);
    }
}
