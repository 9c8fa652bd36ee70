package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.entity.AppointmentRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

@Component
public class AppointmentMapper implements SourceRecordMapper<AppointmentRecord> {

    @Override
    public AppointmentRecord map(JsonNode raw) {
        return AppointmentRecord.builder()
                .sourceId(SourceFields.requireId(raw))
                .jobId(SourceFields.longValue(raw, "jobId"))
                .appointmentNumber(SourceFields.text(raw, "appointmentNumber"))
                .status(SourceFields.nameOrText(raw, "status"))
                .startsAt(SourceFields.instant(raw, "start"))
                .sourceModifiedOn(SourceFields.instant(raw, "modifiedOn"))
                .build();
    }
}
