package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.AppointmentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AppointmentRecordRepository extends JpaRepository<AppointmentRecord, Long> {

    Optional<AppointmentRecord> findByTenantIdAndSourceId(String tenantId, Long sourceId);
}
