package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.SyncCursor;
import com.example.pipelinesync.entity.SyncMode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SyncCursorRepository extends JpaRepository<SyncCursor, Long> {

    Optional<SyncCursor> findByEntityNameAndMode(String entityName, SyncMode mode);
}
