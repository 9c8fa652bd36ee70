package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.config.TargetApiProperties;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.entity.TargetOpportunity.OpportunityStatus;
import com.example.pipelinesync.exception.RecordValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Maps a Target opportunity payload to its local mirror row (not yet persisted).
 * Linked Source ids come from the configured custom fields.
 */
@Component
@RequiredArgsConstructor
public class TargetOpportunityMapper {

    private static final String[] CUSTOM_FIELD_VALUE_KEYS = {
            "fieldValue", "fieldValueString", "fieldValueNumber", "field_value", "value"
    };

    private final TargetApiProperties properties;

    /**
     * Accepts both the bare opportunity and the {@code {"opportunity": {...}}} envelope
     * returned by the single-record endpoint.
     */
    public TargetOpportunity map(JsonNode raw) {
        JsonNode node = raw.has("opportunity") ? raw.get("opportunity") : raw;

        String targetId = SourceFields.text(node, "id");
        if (targetId == null || targetId.isBlank()) {
            throw new RecordValidationException("Target opportunity has no id");
        }
        String pipelineId = SourceFields.text(node, "pipelineId");
        String stageId = SourceFields.text(node, "pipelineStageId");
        if (pipelineId == null || stageId == null) {
            throw new RecordValidationException("Target opportunity " + targetId + " has no pipeline or stage");
        }

        TargetApiProperties.CustomFields fields = properties.getCustomFields();
        return TargetOpportunity.builder()
                .targetId(targetId)
                .pipelineId(pipelineId)
                .stageId(stageId)
                .name(SourceFields.text(node, "name"))
                .monetaryValue(SourceFields.decimal(node, "monetaryValue"))
                .status(OpportunityStatus.fromTarget(SourceFields.text(node, "status")))
                .linkedSourceCustomerId(customFieldId(node, fields.getSourceCustomerId()))
                .linkedSourceJobId(customFieldId(node, fields.getSourceJobId()))
                .rawPayload(node.toString())
                .build();
    }

    private Long customFieldId(JsonNode node, String fieldId) {
        JsonNode customFields = node.get("customFields");
        if (fieldId == null || customFields == null || !customFields.isArray()) {
            return null;
        }
        for (JsonNode field : customFields) {
            if (!fieldId.equals(SourceFields.text(field, "id"))) {
                continue;
            }
            for (String key : CUSTOM_FIELD_VALUE_KEYS) {
                String value = SourceFields.text(field, key);
                if (value != null && !value.isBlank()) {
                    try {
                        return new BigDecimal(value.trim()).longValueExact();
                    } catch (NumberFormatException | ArithmeticException e) {
                        throw new RecordValidationException(String.format(
                                "Custom field %s is not a Source id: %s", fieldId, value), e);
                    }
                }
            }
        }
        return null;
    }
}
