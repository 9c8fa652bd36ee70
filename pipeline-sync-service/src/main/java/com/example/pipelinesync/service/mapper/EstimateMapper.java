package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.entity.EstimateRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Estimates report status as {@code {value, name}}; the name is what detection matches on.
 * When the payload has no total, it is the sum of the line item totals.
 */
@Component
public class EstimateMapper implements SourceRecordMapper<EstimateRecord> {

    @Override
    public EstimateRecord map(JsonNode raw) {
        return EstimateRecord.builder()
                .sourceId(SourceFields.requireId(raw))
                .name(SourceFields.text(raw, "name"))
                .customerId(SourceFields.longValue(raw, "customerId"))
                .jobId(SourceFields.longValue(raw, "jobId"))
                .status(SourceFields.nameOrText(raw, "status"))
                .total(total(raw))
                .soldOn(SourceFields.instant(raw, "soldOn"))
                .sourceModifiedOn(SourceFields.instant(raw, "modifiedOn"))
                .build();
    }

    private BigDecimal total(JsonNode raw) {
        BigDecimal total = SourceFields.decimal(raw, "total");
        if (total != null && total.signum() != 0) {
            return total;
        }
        JsonNode items = raw.get("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            return total;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (JsonNode item : items) {
            BigDecimal itemTotal = SourceFields.decimal(item, "total");
            if (itemTotal != null) {
                sum = sum.add(itemTotal);
            }
        }
        return sum;
    }
}
