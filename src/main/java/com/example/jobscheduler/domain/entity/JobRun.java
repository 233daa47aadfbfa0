package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of one execution attempt of a scheduled job.
 * Runs are append-only: one per attempt, closed exactly once.
 */
@Entity
@Table(name = "job_runs", indexes = {
        @Index(name = "idx_run_job_started", columnList = "job_id, started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    /**
     * Engine response, truncated
     */
    @Column(name = "result_summary", columnDefinition = "TEXT")
    private String resultSummary;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    /**
     * HTTP status of the webhook delivery, 0 when the transport failed
     */
    @Column(name = "webhook_status")
    private Integer webhookStatus;

    /**
     * Close the run as completed
     *
     * @throws IllegalStateException if the run was already closed
     */
    public void complete(Instant finishedAt, String resultSummary, int webhookStatus) {
        transitionTo(RunStatus.COMPLETED);
        this.finishedAt = finishedAt;
        this.resultSummary = resultSummary;
        this.webhookStatus = webhookStatus;
    }

    /**
     * Close the run as failed
     *
     * @throws IllegalStateException if the run was already closed
     */
    public void fail(Instant finishedAt, String error) {
        transitionTo(RunStatus.FAILED);
        this.finishedAt = finishedAt;
        this.error = error;
    }

    private void transitionTo(RunStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new IllegalStateException("Run " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }
}
