package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.CustomerRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CustomerRecordRepository extends JpaRepository<CustomerRecord, Long> {

    Optional<CustomerRecord> findByTenantIdAndSourceId(String tenantId, Long sourceId);
}
