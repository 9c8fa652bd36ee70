package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.MirroredEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Idempotent writes of mirrored Source records.
 * Uses native PostgreSQL ON CONFLICT on (tenant_id, source_id); RETURNING (xmax = 0)
 * is true only for a freshly inserted row, which drives the created/updated counters.
 *
 * Each call is its own statement and commits on return, so a fetcher can persist its
 * cursor knowing every record upserted before it is durable.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MirrorUpsertRepository {

    private final JdbcTemplate jdbcTemplate;

    private final Map<String, String> statements = new ConcurrentHashMap<>();

    /**
     * @return {@code true} if the row was inserted, {@code false} if an existing row was updated
     */
    public <E extends MirroredEntity> boolean upsert(MirrorTable<E> table, E record) {
        String sql = statements.computeIfAbsent(table.getTableName(), name -> buildSql(table));

        List<Object> args = new ArrayList<>();
        args.add(record.getTenantId());
        args.add(record.getSourceId());
        for (Object value : table.bind(record)) {
            args.add(value instanceof Instant instant ? Timestamp.from(instant) : value);
        }
        args.add(record.getSourceModifiedOn() != null ? Timestamp.from(record.getSourceModifiedOn()) : null);
        args.add(record.getRawPayload());
        args.add(Timestamp.from(record.getFetchedAt()));

        Boolean inserted = jdbcTemplate.queryForObject(sql, Boolean.class, args.toArray());
        log.trace("Upserted {} sourceId={} inserted={}", table.getTableName(), record.getSourceId(), inserted);
        return Boolean.TRUE.equals(inserted);
    }

    public long count(String tableName, String tenantId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + tableName + " WHERE tenant_id = ?", Long.class, tenantId);
        return count != null ? count : 0;
    }

    private static String buildSql(MirrorTable<?> table) {
        List<String> typed = table.getColumns();
        String insertColumns = typed.isEmpty() ? "" : String.join(", ", typed) + ", ";
        String placeholders = typed.stream().map(c -> "?").collect(Collectors.joining(", "));
        String updates = typed.stream()
                .map(c -> c + " = EXCLUDED." + c + ",\n    ")
                .collect(Collectors.joining());

        return "INSERT INTO " + table.getTableName() + " (\n"
                + "    tenant_id, source_id, " + insertColumns + "source_modified_on, raw_payload, fetched_at\n"
                + ") VALUES (?, ?, " + (typed.isEmpty() ? "" : placeholders + ", ") + "?, ?::jsonb, ?)\n"
                + "ON CONFLICT (tenant_id, source_id)\n"
                + "DO UPDATE SET\n    "
                + updates
                + "source_modified_on = EXCLUDED.source_modified_on,\n"
                + "    raw_payload = EXCLUDED.raw_payload,\n"
                + "    fetched_at = EXCLUDED.fetched_at\n"
                + "RETURNING (xmax = 0) AS inserted";
    }
}
