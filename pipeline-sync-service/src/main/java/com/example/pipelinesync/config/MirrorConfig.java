package com.example.pipelinesync.config;

import com.example.pipelinesync.client.source.SourceApiClient;
import com.example.pipelinesync.entity.AppointmentRecord;
import com.example.pipelinesync.entity.BusinessUnitRecord;
import com.example.pipelinesync.entity.CustomerRecord;
import com.example.pipelinesync.entity.EstimateRecord;
import com.example.pipelinesync.entity.JobRecord;
import com.example.pipelinesync.entity.MirroredEntity;
import com.example.pipelinesync.repository.MirrorTable;
import com.example.pipelinesync.repository.MirrorUpsertRepository;
import com.example.pipelinesync.service.mapper.AppointmentMapper;
import com.example.pipelinesync.service.mapper.BusinessUnitMapper;
import com.example.pipelinesync.service.mapper.CustomerMapper;
import com.example.pipelinesync.service.mapper.EstimateMapper;
import com.example.pipelinesync.service.mapper.JobMapper;
import com.example.pipelinesync.service.mirror.EntityLock;
import com.example.pipelinesync.service.mirror.MirrorDefinition;
import com.example.pipelinesync.service.mirror.PaginatedFetcher;
import com.example.pipelinesync.service.mirror.SyncCursorService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * One {@link PaginatedFetcher} per mirrored Source entity.
 */
@Configuration
@RequiredArgsConstructor
public class MirrorConfig {

    public static final MirrorTable<CustomerRecord> CUSTOMERS = new MirrorTable<>("st_customers",
            List.of("name", "customer_type", "active"),
            r -> values(r.getName(), r.getCustomerType(), r.getActive()));

    public static final MirrorTable<BusinessUnitRecord> BUSINESS_UNITS = new MirrorTable<>("st_business_units",
            List.of("name", "active"),
            r -> values(r.getName(), r.getActive()));

    public static final MirrorTable<JobRecord> JOBS = new MirrorTable<>("st_jobs",
            List.of("job_number", "customer_id", "business_unit_id", "job_status", "summary", "source_created_on"),
            r -> values(r.getJobNumber(), r.getCustomerId(), r.getBusinessUnitId(), r.getJobStatus(),
                    r.getSummary(), r.getSourceCreatedOn()));

    public static final MirrorTable<EstimateRecord> ESTIMATES = new MirrorTable<>("st_estimates",
            List.of("name", "customer_id", "job_id", "status", "total", "sold_on"),
            r -> values(r.getName(), r.getCustomerId(), r.getJobId(), r.getStatus(), r.getTotal(), r.getSoldOn()));

    public static final MirrorTable<AppointmentRecord> APPOINTMENTS = new MirrorTable<>("st_appointments",
            List.of("job_id", "appointment_number", "status", "starts_at"),
            r -> values(r.getJobId(), r.getAppointmentNumber(), r.getStatus(), r.getStartsAt()));

    private final SourceApiClient sourceApiClient;
    private final MirrorUpsertRepository upsertRepository;
    private final SyncCursorService cursorService;
    private final EntityLock entityLock;
    private final SourceApiProperties sourceProperties;
    private final MirrorSyncProperties mirrorProperties;
    private final Clock clock;

    @Bean
    public PaginatedFetcher<CustomerRecord> customersFetcher(CustomerMapper mapper) {
        return fetcher(MirrorDefinition.<CustomerRecord>builder()
                .entityName("customers")
                .listPath("/crm/v2/tenant/{tenant}/customers")
                .exportPath("/crm/v2/tenant/{tenant}/export/customers")
                .table(CUSTOMERS)
                .mapper(mapper)
                .build());
    }

    @Bean
    public PaginatedFetcher<BusinessUnitRecord> businessUnitsFetcher(BusinessUnitMapper mapper) {
        return fetcher(MirrorDefinition.<BusinessUnitRecord>builder()
                .entityName("business-units")
                .listPath("/settings/v2/tenant/{tenant}/business-units")
                .exportPath("/settings/v2/tenant/{tenant}/export/business-units")
                .table(BUSINESS_UNITS)
                .mapper(mapper)
                .build());
    }

    @Bean
    public PaginatedFetcher<JobRecord> jobsFetcher(JobMapper mapper) {
        return fetcher(MirrorDefinition.<JobRecord>builder()
                .entityName("jobs")
                .listPath("/jpm/v2/tenant/{tenant}/jobs")
                .exportPath("/jpm/v2/tenant/{tenant}/export/jobs")
                .table(JOBS)
                .mapper(mapper)
                .build());
    }

    @Bean
    public PaginatedFetcher<EstimateRecord> estimatesFetcher(EstimateMapper mapper) {
        return fetcher(MirrorDefinition.<EstimateRecord>builder()
                .entityName("estimates")
                .listPath("/sales/v2/tenant/{tenant}/estimates")
                .exportPath("/sales/v2/tenant/{tenant}/export/estimates")
                .table(ESTIMATES)
                .mapper(mapper)
                .build());
    }

    @Bean
    public PaginatedFetcher<AppointmentRecord> appointmentsFetcher(AppointmentMapper mapper) {
        return fetcher(MirrorDefinition.<AppointmentRecord>builder()
                .entityName("appointments")
                .listPath("/jpm/v2/tenant/{tenant}/appointments")
                .exportPath("/jpm/v2/tenant/{tenant}/export/appointments")
                .table(APPOINTMENTS)
                .mapper(mapper)
                .build());
    }

    private <E extends MirroredEntity> PaginatedFetcher<E> fetcher(MirrorDefinition<E> definition) {
        return new PaginatedFetcher<>(definition, sourceApiClient, upsertRepository, cursorService,
                entityLock, sourceProperties, mirrorProperties, clock);
    }

    private static List<Object> values(Object... values) {
        return Arrays.asList(values);
    }
}
