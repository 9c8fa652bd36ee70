package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "st_estimates",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_st_estimates_tenant_source",
                        columnNames = {"tenant_id", "source_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class EstimateRecord extends MirroredEntity {

    public static final String STATUS_SOLD = "Sold";

    @Column(name = "name", length = 500)
    private String name;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "job_id")
    private Long jobId;

    @Column(name = "status", length = 50)
    private String status;

    @Column(name = "total", precision = 14, scale = 2)
    private BigDecimal total;

    @Column(name = "sold_on")
    private Instant soldOn;
}
