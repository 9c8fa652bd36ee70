package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.entity.AppointmentRecord;
import com.example.pipelinesync.entity.CustomerRecord;
import com.example.pipelinesync.entity.EstimateRecord;
import com.example.pipelinesync.entity.JobRecord;
import com.example.pipelinesync.entity.TargetOpportunity;
import com.example.pipelinesync.entity.TargetOpportunity.OpportunityStatus;
import com.example.pipelinesync.repository.CustomerRecordRepository;
import com.example.pipelinesync.repository.TargetOpportunityRepository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * In-memory stand-in for the mirror tables. The detection queries are evaluated against
 * live state, so writes made by the engine are visible to the next detection pass.
 */
class FakeMirrorState {

    final Map<String, TargetOpportunity> opportunities = new TreeMap<>();
    final List<EstimateRecord> estimates = new ArrayList<>();
    final List<JobRecord> jobs = new ArrayList<>();
    final List<AppointmentRecord> appointments = new ArrayList<>();
    final Map<Long, String> businessUnits = new HashMap<>();
    final Map<Long, String> customers = new HashMap<>();

    private long nextId = 1;

    TargetOpportunity opportunity(String targetId, String pipelineId, String stageId, OpportunityStatus status,
                                  Long customerId, Long jobId) {
        TargetOpportunity opportunity = TargetOpportunity.builder()
                .id(nextId++)
                .targetId(targetId)
                .pipelineId(pipelineId)
                .stageId(stageId)
                .status(status)
                .linkedSourceCustomerId(customerId)
                .linkedSourceJobId(jobId)
                .build();
        opportunities.put(targetId, opportunity);
        return opportunity;
    }

    EstimateRecord estimate(long id, long customerId, String name, String status, String total, Instant soldOn) {
        EstimateRecord estimate = EstimateRecord.builder()
                .tenantId("42")
                .sourceId(id)
                .customerId(customerId)
                .name(name)
                .status(status)
                .total(total != null ? new BigDecimal(total) : null)
                .soldOn(soldOn)
                .build();
        estimates.add(estimate);
        return estimate;
    }

    JobRecord job(long id, long customerId, long businessUnitId, String summary, Instant createdOn) {
        JobRecord job = JobRecord.builder()
                .tenantId("42")
                .sourceId(id)
                .customerId(customerId)
                .businessUnitId(businessUnitId)
                .summary(summary)
                .sourceCreatedOn(createdOn)
                .build();
        jobs.add(job);
        return job;
    }

    AppointmentRecord appointment(long id, long jobId, String status) {
        AppointmentRecord appointment = AppointmentRecord.builder()
                .tenantId("42")
                .sourceId(id)
                .jobId(jobId)
                .status(status)
                .build();
        appointments.add(appointment);
        return appointment;
    }

    TargetOpportunityRepository opportunityRepository() {
        TargetOpportunityRepository repository = mock(TargetOpportunityRepository.class);

        when(repository.findByTargetId(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(opportunities.get(invocation.<String>getArgument(0))));
        when(repository.save(any(TargetOpportunity.class))).thenAnswer(invocation -> {
            TargetOpportunity opportunity = invocation.getArgument(0);
            if (opportunity.getId() == null) {
                opportunity.setId(nextId++);
            }
            opportunities.put(opportunity.getTargetId(), opportunity);
            return opportunity;
        });

        when(repository.findSoldCandidates(anyString(), anyCollection(), any(), anyString(), anyString()))
                .thenAnswer(invocation -> {
                    String pipelineId = invocation.getArgument(0);
                    Collection<String> stageIds = invocation.getArgument(1);
                    OpportunityStatus status = invocation.getArgument(2);
                    String estimateStatus = invocation.getArgument(4);
                    List<Object[]> rows = new ArrayList<>();
                    for (TargetOpportunity o : opportunities.values()) {
                        if (!o.getPipelineId().equals(pipelineId) || !stageIds.contains(o.getStageId())
                                || o.getStatus() != status) {
                            continue;
                        }
                        estimates.stream()
                                .filter(e -> Objects.equals(e.getCustomerId(), o.getLinkedSourceCustomerId()))
                                .filter(e -> estimateStatus.equalsIgnoreCase(e.getStatus()))
                                .sorted(Comparator.comparing(EstimateRecord::getSourceId))
                                .forEach(e -> rows.add(new Object[]{o, e}));
                    }
                    return rows;
                });

        when(repository.findInstallCandidates(anyString(), anyString(), anyCollection(), anyString(), any(), anyString()))
                .thenAnswer(invocation -> {
                    String pipelineId = invocation.getArgument(0);
                    String stageId = invocation.getArgument(1);
                    Collection<OpportunityStatus> statuses = invocation.getArgument(2);
                    Instant createdAfter = invocation.getArgument(4);
                    String installPipelineId = invocation.getArgument(5);
                    List<Object[]> rows = new ArrayList<>();
                    for (TargetOpportunity o : opportunities.values()) {
                        if (!o.getPipelineId().equals(pipelineId) || !o.getStageId().equals(stageId)
                                || !statuses.contains(o.getStatus())) {
                            continue;
                        }
                        jobs.stream()
                                .filter(j -> Objects.equals(j.getCustomerId(), o.getLinkedSourceCustomerId()))
                                .filter(j -> j.getSourceCreatedOn() != null && !j.getSourceCreatedOn().isBefore(createdAfter))
                                .filter(j -> o.getLinkedSourceJobId() == null || !j.getSourceId().equals(o.getLinkedSourceJobId()))
                                .filter(j -> businessUnits.containsKey(j.getBusinessUnitId()))
                                .filter(j -> opportunities.values().stream().noneMatch(x ->
                                        x.getPipelineId().equals(installPipelineId)
                                                && j.getSourceId().equals(x.getLinkedSourceJobId())))
                                .sorted(Comparator.comparing(JobRecord::getSourceId))
                                .forEach(j -> rows.add(new Object[]{o, j, businessUnits.get(j.getBusinessUnitId())}));
                    }
                    return rows;
                });

        when(repository.findInProgressCandidates(anyString(), anyCollection(), any(), anyString(), anyCollection()))
                .thenAnswer(invocation -> {
                    String pipelineId = invocation.getArgument(0);
                    Collection<String> stageIds = invocation.getArgument(1);
                    OpportunityStatus status = invocation.getArgument(2);
                    Collection<String> activeStatuses = invocation.getArgument(4);
                    List<Object[]> rows = new ArrayList<>();
                    for (TargetOpportunity o : opportunities.values()) {
                        if (!o.getPipelineId().equals(pipelineId) || !stageIds.contains(o.getStageId())
                                || o.getStatus() != status) {
                            continue;
                        }
                        appointments.stream()
                                .filter(a -> Objects.equals(a.getJobId(), o.getLinkedSourceJobId()))
                                .filter(a -> a.getStatus() != null
                                        && activeStatuses.contains(a.getStatus().toLowerCase(Locale.ROOT)))
                                .sorted(Comparator.comparing(AppointmentRecord::getSourceId))
                                .forEach(a -> rows.add(new Object[]{o, a}));
                    }
                    return rows;
                });

        return repository;
    }

    CustomerRecordRepository customerRepository() {
        CustomerRecordRepository repository = mock(CustomerRecordRepository.class);
        when(repository.findByTenantIdAndSourceId(anyString(), anyLong())).thenAnswer(invocation -> {
            Long id = invocation.getArgument(1);
            String name = customers.get(id);
            return name == null ? Optional.empty()
                    : Optional.of(CustomerRecord.builder().tenantId("42").sourceId(id).name(name).build());
        });
        return repository;
    }
}
