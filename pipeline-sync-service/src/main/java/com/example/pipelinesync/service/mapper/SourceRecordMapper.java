package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.entity.MirroredEntity;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Projects one raw Source record onto its typed mirror row.
 * Tenant, raw payload and fetch time are filled in by the fetcher.
 */
public interface SourceRecordMapper<E extends MirroredEntity> {

    /**
     * @throws com.example.pipelinesync.exception.RecordValidationException when the record is malformed
     */
    E map(JsonNode raw);
}
