package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

@Entity
@Table(name = "st_jobs",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_st_jobs_tenant_source",
                        columnNames = {"tenant_id", "source_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class JobRecord extends MirroredEntity {

    @Column(name = "job_number", length = 50)
    private String jobNumber;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "business_unit_id")
    private Long businessUnitId;

    @Column(name = "job_status", length = 50)
    private String jobStatus;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "source_created_on")
    private Instant sourceCreatedOn;
}
