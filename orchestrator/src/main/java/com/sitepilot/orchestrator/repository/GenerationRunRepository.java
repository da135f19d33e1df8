package com.sitepilot.orchestrator.repository;

import com.sitepilot.orchestrator.model.GenerationRun;
import com.sitepilot.orchestrator.model.RunState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the generation_runs table.
 */
public interface GenerationRunRepository extends JpaRepository<GenerationRun, UUID> {

    /** Newest first. Used by GET /sessions/{id}/generations. */
    List<GenerationRun> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    /**
     * Cancel a run that no worker has picked up yet. A no-op (returns 0) once
     * the run has started, since the worker then records the cancellation.
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE GenerationRun r
               SET r.state = :cancelled,
                   r.success = false,
                   r.error = :reason,
                   r.finishedAt = :now,
                   r.updatedAt = :now
             WHERE r.id = :id AND r.state = :queued
            """)
    int cancelIfQueued(@Param("id") UUID id,
                       @Param("queued") RunState queued,
                       @Param("cancelled") RunState cancelled,
                       @Param("reason") String reason,
                       @Param("now") Instant now);
}
