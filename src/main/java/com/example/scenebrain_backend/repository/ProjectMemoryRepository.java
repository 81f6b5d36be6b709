package com.example.scenebrain_backend.repository;

import com.example.scenebrain_backend.model.ProjectMemory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProjectMemoryRepository extends JpaRepository<ProjectMemory, UUID> {
    Optional<ProjectMemory> findByProjectIdAndMemoryKey(UUID projectId, String memoryKey);

    @Query("""
       select m from ProjectMemory m
       where m.projectId = :projectId
         and m.memoryKey like concat(:prefix, '%')
       order by m.memoryKey
    """)
    List<ProjectMemory> findByPrefix(@Param("projectId") UUID projectId, @Param("prefix") String prefix);
}
