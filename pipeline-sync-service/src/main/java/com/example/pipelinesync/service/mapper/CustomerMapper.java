package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.entity.CustomerRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

@Component
public class CustomerMapper implements SourceRecordMapper<CustomerRecord> {

    @Override
    public CustomerRecord map(JsonNode raw) {
        return CustomerRecord.builder()
                .sourceId(SourceFields.requireId(raw))
                .name(SourceFields.text(raw, "name"))
                .customerType(SourceFields.nameOrText(raw, "type"))
                .active(SourceFields.bool(raw, "active"))
                .sourceModifiedOn(SourceFields.instant(raw, "modifiedOn"))
                .build();
    }
}
