package com.example.alertscheduler.domain.entity;

import com.example.alertscheduler.domain.enums.ParseMode;
import com.example.alertscheduler.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A persisted alert schedule: a cron recurrence in a timezone paired with the
 * message to deliver, plus the run history of its most recent deliveries.
 * <p>
 * User-editable fields are changed only through the scheduling API.
 * Run history fields are written only by the outcome recorder.
 */
@Entity
@Table(name = "schedules", indexes = {
        @Index(name = "idx_schedule_created_at", columnList = "created_at"),
        @Index(name = "idx_schedule_is_active", columnList = "is_active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    /**
     * Five-field (minute first) or six-field (second first) cron expression
     */
    @Column(name = "cron_expression", nullable = false, length = 120)
    private String cronExpression;

    /**
     * IANA timezone the cron expression is evaluated in
     */
    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "message", nullable = false, columnDefinition = "text")
    private String message;

    @Column(name = "parse_mode", nullable = false, length = 20)
    @Builder.Default
    private ParseMode parseMode = ParseMode.HTML;

    /**
     * Only active schedules hold a live timer
     */
    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    // === Run History ===

    /**
     * Most recent delivery attempt, successful or not
     */
    @Column(name = "last_run_at")
    private Instant lastRunAt;

    /**
     * Most recent successful delivery
     */
    @Column(name = "last_sent_at")
    private Instant lastSentAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_status", length = 20)
    private RunStatus lastStatus;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    /**
     * Consecutive failed deliveries since the last success
     */
    @Column(name = "failure_count", nullable = false)
    @Builder.Default
    private Integer failureCount = 0;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // === Lifecycle Callbacks ===

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.parseMode == null) {
            this.parseMode = ParseMode.HTML;
        }
        if (this.failureCount == null) {
            this.failureCount = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
