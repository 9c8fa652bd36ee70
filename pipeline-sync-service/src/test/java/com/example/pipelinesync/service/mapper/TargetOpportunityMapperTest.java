package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.config.TargetApiProperties;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.entity.TargetOpportunity.OpportunityStatus;
import com.example.pipelinesync.exception.RecordValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetOpportunityMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TargetOpportunityMapper mapper;

    @BeforeEach
    void setUp() {
        TargetApiProperties properties = new TargetApiProperties();
        properties.getCustomFields().setSourceCustomerId("cf-customer");
        properties.getCustomFields().setSourceJobId("cf-job");
        mapper = new TargetOpportunityMapper(properties);
    }

    @Test
    void unwrapsSingleRecordEnvelope() throws Exception {
        TargetOpportunity opportunity = mapper.map(objectMapper.readTree("""
                {"opportunity": {"id": "O1", "pipelineId": "sales-pipe", "pipelineStageId": "s-proposal",
                  "name": "Jane Doe", "monetaryValue": 1500, "status": "won",
                  "customFields": [{"id": "cf-customer", "fieldValue": "1001"},
                                   {"id": "cf-job", "fieldValueNumber": 7001.0},
                                   {"id": "unrelated", "fieldValue": "x"}]}}
                """));

        assertThat(opportunity.getTargetId()).isEqualTo("O1");
        assertThat(opportunity.getPipelineId()).isEqualTo("sales-pipe");
        assertThat(opportunity.getStageId()).isEqualTo("s-proposal");
        assertThat(opportunity.getName()).isEqualTo("Jane Doe");
        assertThat(opportunity.getMonetaryValue()).isEqualByComparingTo("1500");
        assertThat(opportunity.getStatus()).isEqualTo(OpportunityStatus.WON);
        assertThat(opportunity.getLinkedSourceCustomerId()).isEqualTo(1001L);
        assertThat(opportunity.getLinkedSourceJobId()).isEqualTo(7001L);
        assertThat(opportunity.getRawPayload()).contains("\"id\":\"O1\"");
    }

    @Test
    void missingLinksAndUnknownStatusAreTolerated() throws Exception {
        TargetOpportunity opportunity = mapper.map(objectMapper.readTree("""
                {"id": "O2", "pipelineId": "sales-pipe", "pipelineStageId": "s-new-lead", "status": "pending"}
                """));

        assertThat(opportunity.getStatus()).isEqualTo(OpportunityStatus.UNKNOWN);
        assertThat(opportunity.getLinkedSourceCustomerId()).isNull();
        assertThat(opportunity.getLinkedSourceJobId()).isNull();
    }

    @Test
    void missingStatusIsUnknownAndKnownStatusIgnoresCase() throws Exception {
        TargetOpportunity missing = mapper.map(objectMapper.readTree("""
                {"id": "O3", "pipelineId": "sales-pipe", "pipelineStageId": "s-new-lead"}
                """));
        TargetOpportunity open = mapper.map(objectMapper.readTree("""
                {"id": "O4", "pipelineId": "sales-pipe", "pipelineStageId": "s-new-lead", "status": "Open"}
                """));

        assertThat(missing.getStatus()).isEqualTo(OpportunityStatus.UNKNOWN);
        assertThat(open.getStatus()).isEqualTo(OpportunityStatus.OPEN);
    }

    @Test
    void opportunityWithoutStageIsRejected() throws Exception {
        assertThatThrownBy(() -> mapper.map(objectMapper.readTree("{\"id\": \"O3\", \"pipelineId\": \"sales-pipe\"}")))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("O3");
        assertThatThrownBy(() -> mapper.map(objectMapper.readTree("{\"pipelineId\": \"sales-pipe\"}")))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("no id");
    }

    @Test
    void nonNumericLinkIsRejected() throws Exception {
        assertThatThrownBy(() -> mapper.map(objectMapper.readTree("""
                {"id": "O4", "pipelineId": "p", "pipelineStageId": "s",
                 "customFields": [{"id": "cf-job", "field_value": "J-17"}]}
                """)))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("cf-job");
    }
}
