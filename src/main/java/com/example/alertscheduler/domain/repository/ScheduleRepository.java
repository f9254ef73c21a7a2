package com.example.alertscheduler.domain.repository;

import com.example.alertscheduler.domain.entity.Schedule;
import com.example.alertscheduler.domain.enums.ParseMode;
import com.example.alertscheduler.domain.enums.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for Schedule entity.
 * <p>
 * Pure data access: scheduling decisions live in the execution engine.
 * Run history is written with single-statement updates so a concurrent
 * reader never sees a half-applied outcome.
 */
@Repository
public interface ScheduleRepository extends JpaRepository<Schedule, Long> {

    /**
     * All schedules, newest first
     */
    List<Schedule> findAllByOrderByCreatedAtDesc();

    /**
     * Active schedules, used by the reconciliation on startup
     */
    List<Schedule> findByActiveTrue();

    long countByActiveTrue();

    /**
     * Overwrite the user-editable columns only. Run history written concurrently
     * by a tick is left as it is.
     *
     * @return number of rows updated (0 if the schedule no longer exists)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.name = :name,
                s.cronExpression = :cronExpression,
                s.timezone = :timezone,
                s.message = :message,
                s.parseMode = :parseMode,
                s.active = :active,
                s.updatedAt = :now
            WHERE s.id = :id
            """)
    int updateEditableFields(@Param("id") Long id,
                             @Param("name") String name,
                             @Param("cronExpression") String cronExpression,
                             @Param("timezone") String timezone,
                             @Param("message") String message,
                             @Param("parseMode") ParseMode parseMode,
                             @Param("active") boolean active,
                             @Param("now") Instant now);

    /**
     * Record a successful delivery: clears all failure bookkeeping.
     *
     * @return number of rows updated (0 if the schedule no longer exists)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.lastRunAt = :now,
                s.lastSentAt = :now,
                s.lastStatus = :status,
                s.lastError = NULL,
                s.failureCount = 0,
                s.updatedAt = :now
            WHERE s.id = :id
            """)
    int markSendSuccess(@Param("id") Long id, @Param("status") RunStatus status, @Param("now") Instant now);

    /**
     * Record a failed delivery. lastSentAt is left untouched.
     *
     * @return number of rows updated (0 if the schedule no longer exists)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.lastRunAt = :now,
                s.lastStatus = :status,
                s.lastError = :lastError,
                s.failureCount = s.failureCount + 1,
                s.updatedAt = :now
            WHERE s.id = :id
            """)
    int markSendFailure(@Param("id") Long id, @Param("status") RunStatus status, @Param("lastError") String lastError, @Param("now") Instant now);
}
