package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.JobRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for JobRun entity
 */
@Repository
public interface JobRunRepository extends JpaRepository<JobRun, UUID> {

    /**
     * Run history for a job, newest first
     */
    List<JobRun> findByJobIdOrderByStartedAtDesc(UUID jobId, Pageable pageable);
}
