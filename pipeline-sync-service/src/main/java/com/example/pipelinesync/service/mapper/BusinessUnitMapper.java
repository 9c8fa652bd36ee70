package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.entity.BusinessUnitRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

@Component
public class BusinessUnitMapper implements SourceRecordMapper<BusinessUnitRecord> {

    @Override
    public BusinessUnitRecord map(JsonNode raw) {
        return BusinessUnitRecord.builder()
                .sourceId(SourceFields.requireId(raw))
                .name(SourceFields.text(raw, "name"))
                .active(SourceFields.bool(raw, "active"))
                .sourceModifiedOn(SourceFields.instant(raw, "modifiedOn"))
                .build();
    }
}
