package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.gateway.NotificationChannels;
import com.gocars.ridesafety.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Check-in lifecycle with a mocked scheduler: deadlines are run by hand.
 */
@ExtendWith(MockitoExtension.class)
class CheckInSchedulerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private TaskScheduler taskScheduler;
    @Mock private SafetyAlertEngine alertEngine;
    @Mock private NotificationChannels notificationChannels;
    @Mock private SafetyEventPublisher eventPublisher;
    @Mock private SessionUpdateListener listener;
    @Mock private ScheduledFuture<?> future;

    private CheckInScheduler checkInScheduler;
    private SessionContext context;
    private MonitoringSession session;

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    @BeforeEach
    void setUp() {
        checkInScheduler = new CheckInScheduler(taskScheduler, alertEngine, notificationChannels, eventPublisher,
                new RideSafetyProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        session = MonitoringSession.builder().id("session-1").rideId("ride-1").userId("user-1").build();
        context = new SessionContext(session, listener);
    }

    private SafetyCheckIn promptWithDeadline(ArgumentCaptor<Runnable> deadline) {
        doReturn(future).when(taskScheduler).schedule(deadline.capture(), any(Instant.class));
        Optional<SafetyCheckIn> checkIn = checkInScheduler.prompt(context, CheckInType.PROMPTED);
        assertThat(checkIn).isPresent();
        return checkIn.get();
    }

    // ── Prompt and deadline ───────────────────────────────────────────────────

    @Test
    @DisplayName("Prompt creates a PENDING check-in, arms its deadline and pushes the prompt")
    void prompt_createsPendingCheckIn() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        SafetyCheckIn checkIn = checkInScheduler.prompt(context, CheckInType.PROMPTED).orElseThrow();

        assertThat(checkIn.getStatus()).isEqualTo(CheckInStatus.PENDING);
        assertThat(checkIn.getDeadline()).isEqualTo(checkIn.getScheduledAt().plusSeconds(30));
        assertThat(session.getCheckIns()).containsExactly(checkIn);
        assertThat(session.getVersion()).isEqualTo(1);

        verify(taskScheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(30)));
        verify(eventPublisher).publishCheckInPrompt(session, checkIn);
        verify(notificationChannels).notifyUser(eq("user-1"), eq("Safety check-in"), anyString());
    }

    @Test
    @DisplayName("Missed deadline marks the check-in MISSED and raises exactly one alert")
    void missedDeadline_singleAlert() {
        ArgumentCaptor<Runnable> deadline = ArgumentCaptor.forClass(Runnable.class);
        SafetyCheckIn checkIn = promptWithDeadline(deadline);

        deadline.getValue().run();
        deadline.getValue().run();

        assertThat(checkIn.getStatus()).isEqualTo(CheckInStatus.MISSED);
        assertThat(checkIn.isFollowUpRequired()).isTrue();
        ArgumentCaptor<SafetySignal> signal = ArgumentCaptor.forClass(SafetySignal.class);
        verify(alertEngine, times(1)).raise(eq(session), signal.capture());
        assertThat(signal.getValue().getType()).isEqualTo(AlertType.CHECK_IN_MISSED);
        assertThat(signal.getValue().getSeverity()).isEqualTo(AlertSeverity.MEDIUM);
    }

    @Test
    @DisplayName("Deadline after a completed answer is a no-op")
    void deadlineAfterCompletion_noOp() {
        ArgumentCaptor<Runnable> deadline = ArgumentCaptor.forClass(Runnable.class);
        SafetyCheckIn checkIn = promptWithDeadline(deadline);

        OperationResult result = checkInScheduler.respond(context, checkIn.getId(),
                CheckInResponse.builder().ok(true).build());
        long version = session.getVersion();
        deadline.getValue().run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(checkIn.getStatus()).isEqualTo(CheckInStatus.COMPLETED);
        assertThat(session.getVersion()).isEqualTo(version);
        verifyNoInteractions(alertEngine);
    }

    @Test
    @DisplayName("Late answer to a missed check-in is recorded as OVERDUE")
    void lateAnswer_overdue() {
        ArgumentCaptor<Runnable> deadline = ArgumentCaptor.forClass(Runnable.class);
        SafetyCheckIn checkIn = promptWithDeadline(deadline);
        deadline.getValue().run();

        OperationResult result = checkInScheduler.respond(context, checkIn.getId(),
                CheckInResponse.builder().ok(true).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(checkIn.getStatus()).isEqualTo(CheckInStatus.OVERDUE);
        assertThat(checkIn.isFollowUpRequired()).isTrue();
        assertThat(checkIn.getCompletedAt()).isNotNull();
    }

    @Test
    @DisplayName("Second answer to the same check-in is rejected")
    void secondAnswer_rejected() {
        ArgumentCaptor<Runnable> deadline = ArgumentCaptor.forClass(Runnable.class);
        SafetyCheckIn checkIn = promptWithDeadline(deadline);
        checkInScheduler.respond(context, checkIn.getId(), CheckInResponse.builder().ok(true).build());

        OperationResult again = checkInScheduler.respond(context, checkIn.getId(),
                CheckInResponse.builder().ok(false).build());

        assertThat(again.isSuccess()).isFalse();
        verifyNoInteractions(alertEngine);
    }

    @Test
    @DisplayName("Answer reporting a problem raises a HIGH alert")
    void notOkAnswer_raisesHighAlert() {
        ArgumentCaptor<Runnable> deadline = ArgumentCaptor.forClass(Runnable.class);
        SafetyCheckIn checkIn = promptWithDeadline(deadline);

        checkInScheduler.respond(context, checkIn.getId(),
                CheckInResponse.builder().ok(false).message("Driver is rude").build());

        ArgumentCaptor<SafetySignal> signal = ArgumentCaptor.forClass(SafetySignal.class);
        verify(alertEngine).raise(eq(session), signal.capture());
        assertThat(signal.getValue().getSeverity()).isEqualTo(AlertSeverity.HIGH);
        assertThat(signal.getValue().getDescription()).contains("Driver is rude");
    }

    // ── Manual and scheduling ─────────────────────────────────────────────────

    @Test
    void manualCheckIn_recordedAsCompleted() {
        OperationResult result = checkInScheduler.manualCheckIn(context, CheckInResponse.builder().ok(true).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(session.getCheckIns()).singleElement()
                .satisfies(c -> {
                    assertThat(c.getType()).isEqualTo(CheckInType.MANUAL);
                    assertThat(c.getStatus()).isEqualTo(CheckInStatus.COMPLETED);
                });
    }

    @Test
    @DisplayName("Inactive session gets no prompt and no timer")
    void inactiveSession_noPrompt() {
        session.setActive(false);

        assertThat(checkInScheduler.prompt(context, CheckInType.AUTOMATIC)).isEmpty();
        verifyNoInteractions(taskScheduler, eventPublisher, notificationChannels);
    }

    @Test
    @DisplayName("Recurring prompts start one interval after start")
    void start_schedulesRecurringPrompts() {
        doReturn(future).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        checkInScheduler.start(context, SafetySettings.defaults("user-1"));

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(NOW.plus(Duration.ofMinutes(10))), eq(Duration.ofMinutes(10)));
    }

    @Test
    void start_disabled_schedulesNothing() {
        checkInScheduler.start(context, SafetySettings.defaults("user-1").toBuilder()
                .automaticCheckInsEnabled(false).build());

        verifyNoInteractions(taskScheduler);
    }
}
