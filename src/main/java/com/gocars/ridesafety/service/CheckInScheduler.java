package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.gateway.NotificationChannels;
import com.gocars.ridesafety.model.AlertSeverity;
import com.gocars.ridesafety.model.AlertType;
import com.gocars.ridesafety.model.CheckInResponse;
import com.gocars.ridesafety.model.CheckInStatus;
import com.gocars.ridesafety.model.CheckInType;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.SafetyCheckIn;
import com.gocars.ridesafety.model.SafetySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic safety check-ins.
 *
 * Each prompt creates a PENDING check-in and its own deadline timer. At the deadline a check-in
 * that is still PENDING becomes MISSED and raises exactly one CHECK_IN_MISSED alert; any other
 * state makes the timer a no-op. All timers belong to the session's task group.
 */
@Service
@Slf4j
public class CheckInScheduler {

    private final TaskScheduler taskScheduler;
    private final SafetyAlertEngine alertEngine;
    private final NotificationChannels notificationChannels;
    private final SafetyEventPublisher eventPublisher;
    private final RideSafetyProperties properties;
    private final Clock clock;

    public CheckInScheduler(@Qualifier("safetyTaskScheduler") TaskScheduler taskScheduler,
                            SafetyAlertEngine alertEngine,
                            NotificationChannels notificationChannels,
                            SafetyEventPublisher eventPublisher,
                            RideSafetyProperties properties,
                            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.alertEngine = alertEngine;
        this.notificationChannels = notificationChannels;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Schedules the recurring prompts of a session; the first one fires one interval after start.
     */
    public void start(SessionContext context, SafetySettings settings) {
        if (!settings.isAutomaticCheckInsEnabled()) {
            log.debug("Automatic check-ins disabled for session {}", context.getSessionId());
            return;
        }
        Duration interval = Duration.ofMinutes(Math.max(1, settings.getCheckInIntervalMinutes()));
        context.addTask(taskScheduler.scheduleAtFixedRate(
                () -> scheduledPrompt(context), clock.instant().plus(interval), interval));
        log.info("Check-ins every {} min scheduled for session {}", interval.toMinutes(), context.getSessionId());
    }

    /**
     * Creates a PENDING check-in, pushes the prompt to the rider and arms its deadline.
     *
     * @return the check-in, empty when the session is no longer active
     */
    public Optional<SafetyCheckIn> prompt(SessionContext context, CheckInType type) {
        Duration timeout = properties.getCheckIn().getResponseTimeout();
        AtomicReference<SafetyCheckIn> created = new AtomicReference<>();

        context.tryUpdate(session -> {
            if (!session.isActive()) {
                return false;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            SafetyCheckIn checkIn = SafetyCheckIn.builder()
                    .id("checkin_" + UUID.randomUUID())
                    .scheduledAt(now)
                    .deadline(now.plus(timeout))
                    .type(type)
                    .build();
            session.getCheckIns().add(checkIn);
            eventPublisher.publishCheckInPrompt(session, checkIn);
            created.set(checkIn);
            return true;
        });

        SafetyCheckIn checkIn = created.get();
        if (checkIn == null) {
            return Optional.empty();
        }
        String checkInId = checkIn.getId();
        context.addTask(taskScheduler.schedule(() -> onDeadline(context, checkInId), clock.instant().plus(timeout)));

        try {
            notificationChannels.notifyUser(context.getSession().getUserId(), "Safety check-in",
                    "Are you safe? Please respond within " + timeout.getSeconds() + " seconds.");
        } catch (RuntimeException e) {
            log.warn("Check-in prompt {} could not be pushed: {}", checkInId, e.getMessage());
        }
        log.info("Check-in {} ({}) prompted for session {}", checkInId, type, context.getSessionId());
        return Optional.of(checkIn);
    }

    /**
     * Deadline of one check-in. Only a PENDING check-in is affected.
     *
     * @return whether the check-in was marked MISSED
     */
    public boolean onDeadline(SessionContext context, String checkInId) {
        return context.tryUpdate(session -> {
            if (!session.isActive()) {
                return false;
            }
            SafetyCheckIn checkIn = session.findCheckIn(checkInId).orElse(null);
            if (checkIn == null || !checkIn.isPending()) {
                return false;
            }
            checkIn.setStatus(CheckInStatus.MISSED);
            checkIn.setFollowUpRequired(true);
            log.warn("Check-in {} of session {} missed", checkInId, session.getId());
            alertEngine.raise(session, SafetySignal.builder()
                    .type(AlertType.CHECK_IN_MISSED)
                    .severity(AlertSeverity.MEDIUM)
                    .description("Safety check-in was not answered in time")
                    .datum("checkInId", checkInId)
                    .build());
            return true;
        });
    }

    /**
     * Rider's answer to a prompted check-in. A PENDING check-in completes; a MISSED one is
     * recorded as OVERDUE and keeps its follow-up flag. A not-ok answer raises a HIGH alert.
     */
    public OperationResult respond(SessionContext context, String checkInId, CheckInResponse response) {
        return context.execute(session -> {
            if (!session.isActive()) {
                return OperationResult.failure("Session " + session.getId() + " is not active");
            }
            Optional<SafetyCheckIn> found = session.findCheckIn(checkInId);
            if (found.isEmpty()) {
                return OperationResult.failure("Check-in " + checkInId + " not found");
            }
            SafetyCheckIn checkIn = found.get();
            if (checkIn.getStatus() == CheckInStatus.PENDING) {
                checkIn.setStatus(CheckInStatus.COMPLETED);
            } else if (checkIn.getStatus() == CheckInStatus.MISSED) {
                checkIn.setStatus(CheckInStatus.OVERDUE);
            } else {
                return OperationResult.failure("Check-in " + checkInId + " is already " + checkIn.getStatus());
            }
            checkIn.setCompletedAt(LocalDateTime.now(clock));
            checkIn.setResponse(response);
            raiseIfNotOk(session, checkIn);
            return OperationResult.success("Check-in " + checkInId + " is " + checkIn.getStatus());
        });
    }

    /**
     * Check-in initiated by the rider, recorded immediately as COMPLETED.
     */
    public OperationResult manualCheckIn(SessionContext context, CheckInResponse response) {
        return context.execute(session -> {
            if (!session.isActive()) {
                return OperationResult.failure("Session " + session.getId() + " is not active");
            }
            LocalDateTime now = LocalDateTime.now(clock);
            SafetyCheckIn checkIn = SafetyCheckIn.builder()
                    .id("checkin_" + UUID.randomUUID())
                    .scheduledAt(now)
                    .completedAt(now)
                    .type(CheckInType.MANUAL)
                    .status(CheckInStatus.COMPLETED)
                    .response(response)
                    .build();
            session.getCheckIns().add(checkIn);
            raiseIfNotOk(session, checkIn);
            return OperationResult.success("Check-in " + checkIn.getId() + " recorded");
        });
    }

    private void raiseIfNotOk(MonitoringSession session, SafetyCheckIn checkIn) {
        CheckInResponse response = checkIn.getResponse();
        if (response == null || response.isOk()) {
            return;
        }
        checkIn.setFollowUpRequired(true);
        alertEngine.raise(session, SafetySignal.builder()
                .type(AlertType.CHECK_IN_MISSED)
                .severity(AlertSeverity.HIGH)
                .description(response.getMessage() != null && !response.getMessage().isBlank()
                        ? "Rider reported a problem: " + response.getMessage()
                        : "Rider reported they do not feel safe")
                .datum("checkInId", checkIn.getId())
                .build());
    }

    private void scheduledPrompt(SessionContext context) {
        try {
            prompt(context, CheckInType.AUTOMATIC);
        } catch (RuntimeException e) {
            log.error("Check-in prompt for session {} failed", context.getSessionId(), e);
        }
    }
}
