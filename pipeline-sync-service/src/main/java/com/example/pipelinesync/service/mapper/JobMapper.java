package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.entity.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

@Component
public class JobMapper implements SourceRecordMapper<JobRecord> {

    @Override
    public JobRecord map(JsonNode raw) {
        return JobRecord.builder()
                .sourceId(SourceFields.requireId(raw))
                .jobNumber(SourceFields.text(raw, "jobNumber"))
                .customerId(SourceFields.longValue(raw, "customerId"))
                .businessUnitId(SourceFields.longValue(raw, "businessUnitId"))
                .jobStatus(SourceFields.nameOrText(raw, "jobStatus"))
                .summary(SourceFields.text(raw, "summary"))
                .sourceCreatedOn(SourceFields.instant(raw, "createdOn"))
                .sourceModifiedOn(SourceFields.instant(raw, "modifiedOn"))
                .build();
    }
}
