package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Local mirror of a Target pipeline opportunity.
 * Refreshed from Target by the opportunity sync and written by the stage-transition engine
 * only after Target accepted the mutation.
 */
@Entity
@Table(name = "target_opportunities",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_target_opportunities_target_id",
                        columnNames = {"target_id"})
        },
        indexes = {
                @Index(name = "idx_target_opportunities_pipeline_stage", columnList = "pipeline_id,stage_id"),
                @Index(name = "idx_target_opportunities_customer", columnList = "linked_source_customer_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TargetOpportunity extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false, length = 100)
    private String targetId;

    @Column(name = "pipeline_id", nullable = false, length = 100)
    private String pipelineId;

    @Column(name = "stage_id", nullable = false, length = 100)
    private String stageId;

    @Column(name = "name", length = 500)
    private String name;

    @Column(name = "monetary_value", precision = 14, scale = 2)
    private BigDecimal monetaryValue;

    @Column(name = "linked_source_job_id")
    private Long linkedSourceJobId;

    @Column(name = "linked_source_customer_id")
    private Long linkedSourceCustomerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OpportunityStatus status;

    @Column(name = "last_transition_at")
    private Instant lastTransitionAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_payload", columnDefinition = "jsonb")
    private String rawPayload;

    @Column(name = "fetched_at")
    private Instant fetchedAt;

    /**
     * Record a transition Target has accepted.
     */
    public void applyTransition(String pipelineId, String stageId, String name, BigDecimal monetaryValue,
                                Long linkedSourceJobId, Instant transitionedAt) {
        this.pipelineId = pipelineId;
        this.stageId = stageId;
        if (name != null) {
            this.name = name;
        }
        if (monetaryValue != null) {
            this.monetaryValue = monetaryValue;
        }
        if (linkedSourceJobId != null) {
            this.linkedSourceJobId = linkedSourceJobId;
        }
        this.lastTransitionAt = transitionedAt;
    }

    public enum OpportunityStatus {
        OPEN,
        WON,
        LOST,
        ABANDONED,
        /** Missing or unrecognised on Target. No transition rule accepts it. */
        UNKNOWN;

        public static OpportunityStatus fromTarget(String value) {
            if (value == null) {
                return UNKNOWN;
            }
            for (OpportunityStatus status : values()) {
                if (status.name().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
            return UNKNOWN;
        }
    }
}
