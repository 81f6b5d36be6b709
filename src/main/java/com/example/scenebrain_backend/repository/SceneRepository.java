package com.example.scenebrain_backend.repository;

import com.example.scenebrain_backend.model.Scene;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface SceneRepository extends JpaRepository<Scene, UUID> {
    List<Scene> findByProjectIdOrderByIntroducedOrderAsc(UUID projectId);

    @Query("select coalesce(max(s.introducedOrder), 0) from Scene s where s.projectId = :projectId")
    long maxIntroducedOrder(@Param("projectId") UUID projectId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update Scene s
           set s.name = :name,
               s.code = :code,
               s.durationInFrames = :durationInFrames,
               s.timelinePosition = :timelinePosition,
               s.templateId = :templateId,
               s.attributesJson = :attributesJson,
               s.deleted = :deleted,
               s.versionToken = :newToken,
               s.updatedAt = :updatedAt
         where s.id = :id
           and s.versionToken = :expectedToken
        """)
    int updateIfToken(@Param("id") UUID id,
                      @Param("expectedToken") long expectedToken,
                      @Param("newToken") long newToken,
                      @Param("name") String name,
                      @Param("code") String code,
                      @Param("durationInFrames") int durationInFrames,
                      @Param("timelinePosition") Integer timelinePosition,
                      @Param("templateId") String templateId,
                      @Param("attributesJson") String attributesJson,
                      @Param("deleted") boolean deleted,
                      @Param("updatedAt") Instant updatedAt);
}
