package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.entity.TargetOpportunity.OpportunityStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Local mirror of Target opportunities plus the stage-transition detection joins.
 *
 * Each detection query selects opportunities sitting in the transition's source stages
 * and joins the Source mirror for the precondition fact. Destination stages are never
 * part of a source set, so a transitioned record drops out of its own query.
 */
@Repository
public interface TargetOpportunityRepository extends JpaRepository<TargetOpportunity, Long> {

    Optional<TargetOpportunity> findByTargetId(String targetId);

    long countByPipelineId(String pipelineId);

    /**
     * Rows of {@code [TargetOpportunity, EstimateRecord]}.
     */
    @Query("SELECT o, e FROM TargetOpportunity o, EstimateRecord e " +
            "WHERE o.pipelineId = :pipelineId " +
            "AND o.stageId IN :stageIds " +
            "AND o.status = :status " +
            "AND e.tenantId = :tenantId " +
            "AND e.customerId = o.linkedSourceCustomerId " +
            "AND LOWER(e.status) = LOWER(:estimateStatus) " +
            "ORDER BY o.targetId, e.sourceId")
    List<Object[]> findSoldCandidates(@Param("pipelineId") String pipelineId,
                                      @Param("stageIds") Collection<String> stageIds,
                                      @Param("status") OpportunityStatus status,
                                      @Param("tenantId") String tenantId,
                                      @Param("estimateStatus") String estimateStatus);

    /**
     * Rows of {@code [TargetOpportunity, JobRecord, business unit name]}.
     * Jobs already linked to an opportunity in the install pipeline are excluded.
     */
    @Query("SELECT o, j, b.name FROM TargetOpportunity o, JobRecord j, BusinessUnitRecord b " +
            "WHERE o.pipelineId = :pipelineId " +
            "AND o.stageId = :stageId " +
            "AND o.status IN :statuses " +
            "AND j.tenantId = :tenantId " +
            "AND j.customerId = o.linkedSourceCustomerId " +
            "AND j.sourceCreatedOn >= :createdAfter " +
            "AND (o.linkedSourceJobId IS NULL OR j.sourceId <> o.linkedSourceJobId) " +
            "AND b.tenantId = j.tenantId " +
            "AND b.sourceId = j.businessUnitId " +
            "AND NOT EXISTS (SELECT 1 FROM TargetOpportunity x " +
            "    WHERE x.pipelineId = :installPipelineId AND x.linkedSourceJobId = j.sourceId) " +
            "ORDER BY o.targetId, j.sourceId")
    List<Object[]> findInstallCandidates(@Param("pipelineId") String pipelineId,
                                         @Param("stageId") String stageId,
                                         @Param("statuses") Collection<OpportunityStatus> statuses,
                                         @Param("tenantId") String tenantId,
                                         @Param("createdAfter") Instant createdAfter,
                                         @Param("installPipelineId") String installPipelineId);

    /**
     * Rows of {@code [TargetOpportunity, AppointmentRecord]}.
     *
     * @param appointmentStatuses lower-case status names
     */
    @Query("SELECT o, a FROM TargetOpportunity o, AppointmentRecord a " +
            "WHERE o.pipelineId = :pipelineId " +
            "AND o.stageId IN :stageIds " +
            "AND o.status = :status " +
            "AND a.tenantId = :tenantId " +
            "AND a.jobId = o.linkedSourceJobId " +
            "AND LOWER(a.status) IN :appointmentStatuses " +
            "ORDER BY o.targetId, a.sourceId")
    List<Object[]> findInProgressCandidates(@Param("pipelineId") String pipelineId,
                                            @Param("stageIds") Collection<String> stageIds,
                                            @Param("status") OpportunityStatus status,
                                            @Param("tenantId") String tenantId,
                                            @Param("appointmentStatuses") Collection<String> appointmentStatuses);
}
