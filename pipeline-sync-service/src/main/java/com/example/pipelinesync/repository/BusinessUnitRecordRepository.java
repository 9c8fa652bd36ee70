package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.BusinessUnitRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BusinessUnitRecordRepository extends JpaRepository<BusinessUnitRecord, Long> {

    Optional<BusinessUnitRecord> findByTenantIdAndSourceId(String tenantId, Long sourceId);
}
