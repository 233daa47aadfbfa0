package com.example.jobscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A natural-language task attached to a recurrence schedule.
 * <p>
 * The owner may only toggle {@code enabled}; {@code lastRunAt} is written
 * exclusively by the job executor after every attempt.
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
        @Index(name = "idx_job_owner_created", columnList = "owner_email, created_at"),
        @Index(name = "idx_job_enabled", columnList = "enabled")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Identifier of the user who owns the job; also scopes the engine toolset
     */
    @Column(name = "owner_email", nullable = false, length = 320)
    private String ownerEmail;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Prompt handed to the task execution engine as-is
     */
    @Column(name = "prompt", nullable = false, columnDefinition = "TEXT")
    private String prompt;

    /**
     * Five-field cron expression (minute hour day-of-month month day-of-week)
     */
    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(name = "webhook_url", nullable = false, length = 2048)
    private String webhookUrl;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /**
     * Start instant of the latest attempt, successful or not
     */
    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
