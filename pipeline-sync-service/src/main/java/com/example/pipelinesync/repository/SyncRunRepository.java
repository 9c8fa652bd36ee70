package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.SyncRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Sync-run log. Read by monitoring, written only through SyncRunService.
 */
@Repository
public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {

    List<SyncRun> findTop20ByEntityNameOrderByStartedAtDesc(String entityName);

    Optional<SyncRun> findFirstByEntityNameAndStatusOrderByStartedAtDesc(String entityName, SyncRun.RunStatus status);
}
