package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ScheduledJob entity
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, UUID> {

    /**
     * Jobs considered by a sweep, in creation order
     */
    List<ScheduledJob> findByEnabledTrueOrderByCreatedAtAsc();

    /**
     * Owner's jobs, newest first
     */
    List<ScheduledJob> findByOwnerEmailOrderByCreatedAtDesc(String ownerEmail);

    Optional<ScheduledJob> findByIdAndOwnerEmail(UUID id, String ownerEmail);

    long countByEnabledTrue();

    /**
     * Advance the last-run marker. The only write path for last_run_at.
     *
     * @return number of rows updated (0 if the job was deleted meanwhile)
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE ScheduledJob j
            SET j.lastRunAt = :lastRunAt
            WHERE j.id = :jobId
            """)
    int updateLastRunAt(@Param("jobId") UUID jobId, @Param("lastRunAt") Instant lastRunAt);

    /**
     * Toggle a job, scoped to its owner
     *
     * @return number of rows updated (0 if not found for this owner)
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE ScheduledJob j
            SET j.enabled = :enabled
            WHERE j.id = :jobId
              AND j.ownerEmail = :ownerEmail
            """)
    int updateEnabled(@Param("jobId") UUID jobId, @Param("ownerEmail") String ownerEmail, @Param("enabled") boolean enabled);

    @Modifying
    @Transactional
    @Query("""
            DELETE FROM ScheduledJob j
            WHERE j.id = :jobId
              AND j.ownerEmail = :ownerEmail
            """)
    int deleteByIdAndOwner(@Param("jobId") UUID jobId, @Param("ownerEmail") String ownerEmail);
}
