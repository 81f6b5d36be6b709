package com.example.scenebrain_backend.repository;

import com.example.scenebrain_backend.model.OrchestrationRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface OrchestrationRunRepository extends JpaRepository<OrchestrationRun, UUID> {
    List<OrchestrationRun> findByProjectIdOrderByStartedAtDesc(UUID projectId, Pageable pageable);
}
