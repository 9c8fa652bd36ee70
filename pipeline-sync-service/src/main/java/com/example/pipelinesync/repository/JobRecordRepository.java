package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.JobRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, Long> {

    Optional<JobRecord> findByTenantIdAndSourceId(String tenantId, Long sourceId);
}
