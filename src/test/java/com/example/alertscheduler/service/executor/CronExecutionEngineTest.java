package com.example.alertscheduler.service.executor;

import com.example.alertscheduler.domain.entity.Schedule;
import com.example.alertscheduler.domain.repository.ScheduleRepository;
import com.example.alertscheduler.exception.InvalidScheduleException;
import com.example.alertscheduler.exception.ScheduleNotFoundException;
import com.example.alertscheduler.service.alert.SlackAlertService;
import com.example.alertscheduler.service.dispatch.DispatchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CronExecutionEngine Tests")
class CronExecutionEngineTest {

    @Mock
    private ScheduleRepository scheduleRepository;

    @Mock
    private ScheduleExecutorService scheduleExecutorService;

    @Mock
    private OutcomeRecorder outcomeRecorder;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private TaskExecutor dispatchExecutor;

    @Captor
    private ArgumentCaptor<Trigger> triggerCaptor;

    @Captor
    private ArgumentCaptor<Runnable> runnableCaptor;

    private CronExecutionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CronExecutionEngine(scheduleRepository, scheduleExecutorService, outcomeRecorder,
                slackAlertService, taskScheduler, dispatchExecutor);
    }

    @Nested
    @DisplayName("install Tests")
    class InstallTests {

        @Test
        @DisplayName("Should register a cron trigger normalized to six fields")
        void shouldRegisterCronTrigger() {
            // Given
            var future = mock(ScheduledFuture.class);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule(1L, "0 18 * * *", true)));
            doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

            // When
            engine.install(1L);

            // Then
            verify(taskScheduler).schedule(any(Runnable.class), triggerCaptor.capture());
            assertThat(triggerCaptor.getValue()).isInstanceOf(CronTrigger.class);
            assertThat(((CronTrigger) triggerCaptor.getValue()).getExpression()).isEqualTo("0 0 18 * * *");
            assertThat(engine.registeredIds()).containsExactly(1L);
        }

        @Test
        @DisplayName("Should cancel the previous timer when reinstalling")
        void shouldCancelPreviousTimerOnReinstall() {
            // Given
            var first = mock(ScheduledFuture.class);
            var second = mock(ScheduledFuture.class);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule(1L, "0 18 * * *", true)));
            doReturn(first).doReturn(second).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

            // When
            engine.install(1L);
            engine.install(1L);

            // Then
            verify(first).cancel(false);
            verify(second, never()).cancel(anyBoolean());
            assertThat(engine.registeredIds()).containsExactly(1L);
        }

        @Test
        @DisplayName("Should fail for an unknown schedule")
        void shouldFailForUnknownSchedule() {
            // Given
            when(scheduleRepository.findById(99L)).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> engine.install(99L))
                    .isInstanceOf(ScheduleNotFoundException.class)
                    .hasMessageContaining("99");
            verifyNoInteractions(taskScheduler);
        }

        @Test
        @DisplayName("Should refuse a schedule whose cron cannot be parsed")
        void shouldRefuseInvalidCron() {
            // Given
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule(1L, "not-a-cron", true)));

            // When / Then
            assertThatThrownBy(() -> engine.install(1L)).isInstanceOf(InvalidScheduleException.class);
            assertThat(engine.registeredIds()).isEmpty();
        }
    }

    @Nested
    @DisplayName("uninstall Tests")
    class UninstallTests {

        @Test
        @DisplayName("Should be idempotent")
        void shouldBeIdempotent() {
            // Given
            var future = mock(ScheduledFuture.class);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule(1L, "0 18 * * *", true)));
            doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
            engine.install(1L);

            // When
            engine.uninstall(1L);
            engine.uninstall(1L);
            engine.uninstall(2L);

            // Then
            verify(future, times(1)).cancel(false);
            assertThat(engine.registeredIds()).isEmpty();
        }
    }

    @Nested
    @DisplayName("reconcileAll Tests")
    class ReconcileAllTests {

        @Test
        @DisplayName("Should install timers for active schedules only and skip broken ones")
        void shouldInstallActiveSchedules() {
            // Given
            when(scheduleRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(
                    schedule(1L, "0 18 * * *", true),
                    schedule(2L, "0 21 * * *", false),
                    schedule(3L, "*/5 * * * *", true),
                    schedule(4L, "bogus", true)));
            doReturn(mock(ScheduledFuture.class)).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

            // When
            engine.reconcileAll();

            // Then
            assertThat(engine.registeredIds()).containsExactlyInAnyOrder(1L, 3L);
        }

        @Test
        @DisplayName("shutdown should cancel every timer")
        void shutdownShouldCancelAllTimers() {
            // Given
            var first = mock(ScheduledFuture.class);
            var second = mock(ScheduledFuture.class);
            when(scheduleRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(
                    schedule(1L, "0 18 * * *", true),
                    schedule(2L, "0 21 * * *", true)));
            doReturn(first).doReturn(second).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
            engine.reconcileAll();

            // When
            engine.shutdown();

            // Then
            verify(first).cancel(false);
            verify(second).cancel(false);
            assertThat(engine.registeredIds()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Tick Tests")
    class TickTests {

        @Test
        @DisplayName("onTick should hand the tick to the dispatch pool")
        void onTickShouldHandOff() {
            // Given
            var schedule = schedule(1L, "0 18 * * *", true);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule));

            // When
            engine.onTick(1L);

            // Then
            verify(dispatchExecutor).execute(runnableCaptor.capture());
            verifyNoInteractions(scheduleExecutorService);

            runnableCaptor.getValue().run();
            verify(scheduleExecutorService).dispatchAndRecord(schedule);
        }

        @Test
        @DisplayName("onTick should record a failure when the dispatch pool is saturated")
        void onTickShouldRecordRejectedTick() {
            // Given
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule(1L, "0 18 * * *", true)));
            doThrow(new TaskRejectedException("queue full")).when(dispatchExecutor).execute(any(Runnable.class));

            // When
            engine.onTick(1L);

            // Then
            verify(outcomeRecorder).record(eq(1L), argThat(outcome -> !outcome.isSent()
                    && CronExecutionEngine.QUEUE_FULL_DETAIL.equals(outcome.getDetail())));
        }

        @Test
        @DisplayName("onTick should not record a rejected tick of a schedule deactivated meanwhile")
        void onTickShouldNotRecordRejectedTickOfInactiveSchedule() {
            // Given
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule(1L, "0 18 * * *", false)));
            doThrow(new TaskRejectedException("queue full")).when(dispatchExecutor).execute(any(Runnable.class));

            // When
            engine.onTick(1L);

            // Then
            verifyNoInteractions(outcomeRecorder);
        }

        @Test
        @DisplayName("onTick should not record a rejected tick of a deleted schedule")
        void onTickShouldNotRecordRejectedTickOfDeletedSchedule() {
            // Given
            when(scheduleRepository.findById(1L)).thenReturn(Optional.empty());
            doThrow(new TaskRejectedException("queue full")).when(dispatchExecutor).execute(any(Runnable.class));

            // When / Then
            assertThatCode(() -> engine.onTick(1L)).doesNotThrowAnyException();
            verifyNoInteractions(outcomeRecorder);
        }

        @Test
        @DisplayName("onTick should contain a store failure while handling a rejected tick")
        void onTickShouldContainLookupFailureOnRejectedTick() {
            // Given
            when(scheduleRepository.findById(1L)).thenThrow(new IllegalStateException("database unavailable"));
            doThrow(new TaskRejectedException("queue full")).when(dispatchExecutor).execute(any(Runnable.class));

            // When / Then
            assertThatCode(() -> engine.onTick(1L)).doesNotThrowAnyException();
            verifyNoInteractions(outcomeRecorder);
        }

        @Test
        @DisplayName("Should do nothing for a deleted schedule")
        void shouldIgnoreDeletedSchedule() {
            // Given
            when(scheduleRepository.findById(1L)).thenReturn(Optional.empty());

            // When
            engine.runTick(1L);

            // Then
            verifyNoInteractions(scheduleExecutorService, outcomeRecorder);
        }

        @Test
        @DisplayName("Should do nothing for an inactive schedule")
        void shouldIgnoreInactiveSchedule() {
            // Given
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule(1L, "0 18 * * *", false)));

            // When
            engine.runTick(1L);

            // Then
            verifyNoInteractions(scheduleExecutorService, outcomeRecorder);
        }

        @Test
        @DisplayName("Should contain exceptions at the tick boundary")
        void shouldContainExceptions() {
            // Given
            var schedule = schedule(1L, "0 18 * * *", true);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule));
            when(scheduleExecutorService.dispatchAndRecord(schedule)).thenThrow(new IllegalStateException("database unavailable"));

            // When / Then
            assertThatCode(() -> engine.runTick(1L)).doesNotThrowAnyException();
            verify(outcomeRecorder).record(eq(1L), argThat(outcome -> !outcome.isSent()
                    && "database unavailable".equals(outcome.getDetail())));
            verify(slackAlertService).sendErrorAlert(eq("Schedule tick failed"), contains("1"), contains("database unavailable"));
        }

        @Test
        @DisplayName("Should record a tick that fails while reading the schedule")
        void shouldRecordFailedLookup() {
            // Given
            when(scheduleRepository.findById(1L)).thenThrow(new IllegalStateException("connection reset"));

            // When
            engine.runTick(1L);

            // Then
            verify(outcomeRecorder).record(eq(1L), argThat(outcome -> !outcome.isSent()
                    && "connection reset".equals(outcome.getDetail())));
            verifyNoInteractions(scheduleExecutorService);
        }

        @Test
        @DisplayName("Should still alert when recording the failed tick fails too")
        void shouldAlertWhenRecordingFails() {
            // Given
            var schedule = schedule(1L, "0 18 * * *", true);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule));
            when(scheduleExecutorService.dispatchAndRecord(schedule)).thenThrow(new IllegalStateException("boom"));
            doThrow(new IllegalStateException("still down")).when(outcomeRecorder).record(eq(1L), any(DispatchOutcome.class));

            // When / Then
            assertThatCode(() -> engine.runTick(1L)).doesNotThrowAnyException();
            verify(slackAlertService).sendErrorAlert(eq("Schedule tick failed"), contains("1"), contains("boom"));
        }

        @Test
        @DisplayName("Should skip a tick while the previous tick of the same schedule is running")
        void shouldSkipOverlappingTick() {
            // Given
            var schedule = schedule(1L, "* * * * * *", true);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule));
            when(scheduleExecutorService.dispatchAndRecord(schedule)).thenAnswer(invocation -> {
                engine.runTick(1L);
                return DispatchOutcome.sent("Telegram alert sent.");
            });

            // When
            engine.runTick(1L);

            // Then
            verify(scheduleExecutorService, times(1)).dispatchAndRecord(schedule);
        }

        @Test
        @DisplayName("Should run the next tick once the previous one finished")
        void shouldRunSequentialTicks() {
            // Given
            var schedule = schedule(1L, "0 18 * * *", true);
            when(scheduleRepository.findById(1L)).thenReturn(Optional.of(schedule));
            when(scheduleExecutorService.dispatchAndRecord(schedule)).thenReturn(DispatchOutcome.failed("down"));

            // When
            engine.runTick(1L);
            engine.runTick(1L);

            // Then
            verify(scheduleExecutorService, times(2)).dispatchAndRecord(schedule);
        }
    }

    private Schedule schedule(Long id, String cron, boolean active) {
        return Schedule.builder()
                .id(id)
                .name("Schedule " + id)
                .cronExpression(cron)
                .timezone("Asia/Phnom_Penh")
                .message("<b>Do something now.</b>")
                .active(active)
                .build();
    }
}
