package com.example.pipelinesync.service.mirror;

import com.example.pipelinesync.entity.MirroredEntity;
import com.example.pipelinesync.repository.MirrorTable;
import com.example.pipelinesync.service.mapper.SourceRecordMapper;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything entity-specific a {@link PaginatedFetcher} needs.
 * Paths carry a {@code {tenant}} placeholder.
 */
@Getter
@Builder
public class MirrorDefinition<E extends MirroredEntity> {

    private final String entityName;

    /** Page-numbered list endpoint accepting modifiedOnOrAfter. */
    private final String listPath;

    /** Export endpoint walked with a continuation token. */
    private final String exportPath;

    private final MirrorTable<E> table;

    private final SourceRecordMapper<E> mapper;
}
