package com.example.pipelinesync.client.target;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial body of PUT /opportunities/{id}. Null fields are left untouched by Target.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OpportunityUpdate {

    private final String pipelineId;

    private final String pipelineStageId;

    private final String name;

    private final BigDecimal monetaryValue;

    @Singular
    private final List<CustomFieldValue> customFields;

    @Getter
    public static class CustomFieldValue {

        private final String id;

        @JsonProperty("field_value")
        private final String value;

        public CustomFieldValue(String id, String value) {
            this.id = id;
            this.value = value;
        }
    }
}
