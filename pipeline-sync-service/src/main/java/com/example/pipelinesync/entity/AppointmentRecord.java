package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

@Entity
@Table(name = "st_appointments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_st_appointments_tenant_source",
                        columnNames = {"tenant_id", "source_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class AppointmentRecord extends MirroredEntity {

    @Column(name = "job_id")
    private Long jobId;

    @Column(name = "appointment_number", length = 50)
    private String appointmentNumber;

    @Column(name = "status", length = 50)
    private String status;

    @Column(name = "starts_at")
    private Instant startsAt;
}
