package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.EstimateRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EstimateRecordRepository extends JpaRepository<EstimateRecord, Long> {

    Optional<EstimateRecord> findByTenantIdAndSourceId(String tenantId, Long sourceId);
}
