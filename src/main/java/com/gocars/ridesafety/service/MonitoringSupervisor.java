package com.gocars.ridesafety.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.exception.IncidentCreationException;
import com.gocars.ridesafety.exception.MonitoringRejectedException;
import com.gocars.ridesafety.model.AlertSeverity;
import com.gocars.ridesafety.model.AlertType;
import com.gocars.ridesafety.model.CheckInResponse;
import com.gocars.ridesafety.model.CheckInType;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.model.SafetyAlert;
import com.gocars.ridesafety.model.SafetySettings;
import com.gocars.ridesafety.model.SessionStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Registry and lifecycle owner of the live monitoring sessions.
 *
 * Per session:
 *  1. location polling every poll interval (fix → deviation → behavior → stop → alerts)
 *  2. recurring check-in prompts, when the rider enabled them
 *
 * Every fix is processed as one atomic step inside the session's {@link SessionContext}; the
 * commit at the end recomputes risk, persists and publishes. Stopping a session closes its task
 * group and removes it from the registry; its final state stays in the record store.
 *
 * Sessions share nothing with each other, so there is no cross-session locking.
 */
@Service
@Slf4j
public class MonitoringSupervisor {

    private final TaskScheduler taskScheduler;
    private final LocationSampler locationSampler;
    private final SettingsResolver settingsResolver;
    private final RouteDeviationDetector deviationDetector;
    private final DriverBehaviorAnalyzer behaviorAnalyzer;
    private final ExtendedStopDetector stopDetector;
    private final SafetyAlertEngine alertEngine;
    private final CheckInScheduler checkInScheduler;
    private final SessionUpdateListener updateListener;
    private final SnapshotMapper snapshotMapper;
    private final RideSafetyProperties properties;
    private final Clock clock;

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();

    public MonitoringSupervisor(@Qualifier("safetyTaskScheduler") TaskScheduler taskScheduler,
                                LocationSampler locationSampler,
                                SettingsResolver settingsResolver,
                                RouteDeviationDetector deviationDetector,
                                DriverBehaviorAnalyzer behaviorAnalyzer,
                                ExtendedStopDetector stopDetector,
                                SafetyAlertEngine alertEngine,
                                CheckInScheduler checkInScheduler,
                                SessionUpdateListener updateListener,
                                SnapshotMapper snapshotMapper,
                                RideSafetyProperties properties,
                                Clock clock) {
        this.taskScheduler = taskScheduler;
        this.locationSampler = locationSampler;
        this.settingsResolver = settingsResolver;
        this.deviationDetector = deviationDetector;
        this.behaviorAnalyzer = behaviorAnalyzer;
        this.stopDetector = stopDetector;
        this.alertEngine = alertEngine;
        this.checkInScheduler = checkInScheduler;
        this.updateListener = updateListener;
        this.snapshotMapper = snapshotMapper;
        this.properties = properties;
        this.clock = clock;
    }

    // ────────────────────────────────────────────────────────────────────────
    // Lifecycle
    // ────────────────────────────────────────────────────────────────────────

    /**
     * Starts monitoring a ride.
     *
     * @throws MonitoringRejectedException if the ride is already monitored or the rider disabled
     *                                     ride monitoring
     */
    public synchronized MonitoringSession startMonitoring(StartMonitoringCommand command) {
        boolean alreadyMonitored = sessions.values().stream()
                .anyMatch(c -> c.getSession().getRideId().equals(command.getRideId()));
        if (alreadyMonitored) {
            throw new MonitoringRejectedException("Ride " + command.getRideId() + " is already being monitored");
        }
        SafetySettings settings = settingsResolver.safetySettings(command.getUserId());
        if (!settings.isRideMonitoringEnabled()) {
            throw new MonitoringRejectedException("Ride monitoring is disabled for user " + command.getUserId());
        }

        MonitoringSession session = MonitoringSession.builder()
                .id("monitoring_" + UUID.randomUUID())
                .rideId(command.getRideId())
                .userId(command.getUserId())
                .driverId(command.getDriverId())
                .startTime(LocalDateTime.now(clock))
                .plannedRoute(new ArrayList<>(command.getPlannedRoute()))
                .build();
        SessionContext context = new SessionContext(session, updateListener);
        sessions.put(session.getId(), context);
        context.update(Function.identity());

        Duration pollInterval = properties.getMonitoring().getPollInterval();
        context.addTask(taskScheduler.scheduleAtFixedRate(
                () -> pollLocation(context), clock.instant().plus(pollInterval), pollInterval));
        checkInScheduler.start(context, settings);

        log.info("Monitoring started — session {}, ride {}, user {}, {} planned points",
                session.getId(), session.getRideId(), session.getUserId(), session.getPlannedRoute().size());
        return session;
    }

    /**
     * Stops a session: cancels its task group and marks it COMPLETED. Stopping an unknown or
     * already stopped session is a failure result.
     */
    public OperationResult stopMonitoring(String sessionId) {
        SessionContext context = sessions.remove(sessionId);
        if (context == null) {
            return OperationResult.failure("No active monitoring session " + sessionId);
        }
        context.close();
        OperationResult result = context.execute(session -> {
            if (!session.isActive()) {
                return OperationResult.failure("Session " + sessionId + " is already stopped");
            }
            session.setActive(false);
            session.setStatus(SessionStatus.COMPLETED);
            session.setEndTime(LocalDateTime.now(clock));
            return OperationResult.success("Monitoring stopped for session " + sessionId);
        });
        log.info("Monitoring stopped — session {}, ride {}", sessionId, context.getSession().getRideId());
        return result;
    }

    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(SessionContext::close);
        log.info("Monitoring supervisor shut down — {} session task group(s) closed", sessions.size());
    }

    // ────────────────────────────────────────────────────────────────────────
    // Location pipeline
    // ────────────────────────────────────────────────────────────────────────

    /**
     * One polling cycle. Never throws: a failing cycle is logged and the next one runs as usual.
     */
    void pollLocation(SessionContext context) {
        if (context.isClosed()) {
            return;
        }
        try {
            Optional<RoutePoint> fix = locationSampler.sample(context.getSession().getUserId());
            if (fix.isPresent()) {
                OperationResult result = processFix(context, fix.get());
                if (!result.isSuccess()) {
                    log.debug("Session {} poll: {}", context.getSessionId(), result.getMessage());
                }
            } else {
                context.tryUpdate(this::recordMissedSample);
            }
        } catch (RuntimeException e) {
            log.error("Polling cycle for session {} failed", context.getSessionId(), e);
        }
    }

    /** Feeds a fix pushed by a client instead of polled. */
    public OperationResult recordFix(String sessionId, RoutePoint fix) {
        return withContext(sessionId, context -> processFix(context, fix));
    }

    OperationResult processFix(SessionContext context, RoutePoint fix) {
        return context.execute(session -> {
            if (!session.isActive()) {
                return OperationResult.failure("Session " + session.getId() + " is not active");
            }
            Optional<RoutePoint> last = session.lastFix();
            if (last.isPresent() && !fix.getTimestamp().isAfter(last.get().getTimestamp())) {
                return OperationResult.failure("Fix at " + fix.getTimestamp() + " is not newer than the last one");
            }

            SafetySettings settings = settingsResolver.safetySettings(session.getUserId());
            session.getActualRoute().add(fix);
            session.setConsecutiveMissedSamples(0);
            session.setCommunicationLossAlerted(false);

            List<SafetySignal> signals = new ArrayList<>();
            deviationDetector.evaluate(session, fix, settings).ifPresent(signals::add);
            if (settings.isDriverBehaviorMonitoring()) {
                signals.addAll(behaviorAnalyzer.analyze(session, settings));
            }
            stopDetector.evaluate(session, fix).ifPresent(signals::add);
            signals.forEach(signal -> alertEngine.raise(session, signal));

            log.debug("Session {} fix ({}, {}) processed — {} signal(s)",
                    session.getId(), fix.getLatitude(), fix.getLongitude(), signals.size());
            return OperationResult.success("Fix recorded");
        });
    }

    private boolean recordMissedSample(MonitoringSession session) {
        if (!session.isActive()) {
            return false;
        }
        int missed = session.getConsecutiveMissedSamples() + 1;
        session.setConsecutiveMissedSamples(missed);
        log.debug("Session {} — no location fix ({} consecutive)", session.getId(), missed);

        if (missed < properties.getMonitoring().getCommunicationLossCycles() || session.isCommunicationLossAlerted()) {
            return false;
        }
        session.setCommunicationLossAlerted(true);
        log.warn("Session {} — no location for {} cycles", session.getId(), missed);
        alertEngine.raise(session, SafetySignal.builder()
                .type(AlertType.COMMUNICATION_LOSS)
                .severity(AlertSeverity.MEDIUM)
                .description("No location received from the rider's device for " + missed + " polling cycles")
                .datum("missedCycles", missed)
                .build());
        return true;
    }

    // ────────────────────────────────────────────────────────────────────────
    // Rider and operator actions
    // ────────────────────────────────────────────────────────────────────────

    /**
     * Raises a CRITICAL PANIC_BUTTON alert, which escalates to an emergency incident.
     *
     * @throws IncidentCreationException when the alert was raised but no incident could be recorded;
     *                                   the alert and its failed escalation are still committed
     */
    public OperationResult triggerPanic(String sessionId) {
        AtomicReference<SafetyAlert> raised = new AtomicReference<>();
        OperationResult result = withContext(sessionId, context -> context.execute(session -> {
            if (!session.isActive()) {
                return OperationResult.failure("Session " + sessionId + " is not active");
            }
            SafetyAlert alert = alertEngine.raise(session, SafetySignal.of(
                    AlertType.PANIC_BUTTON, AlertSeverity.CRITICAL, "Panic button pressed during ride " + session.getRideId()));
            raised.set(alert);
            Object incidentId = alert.getData().get("incidentId");
            return OperationResult.success("Panic alert " + alert.getId() + " raised"
                    + (incidentId != null ? ", incident " + incidentId : ""));
        }));

        SafetyAlert alert = raised.get();
        if (alert != null && alert.getData().get("incidentId") == null) {
            log.error("Panic on session {}: alert {} raised but no emergency incident was recorded",
                    sessionId, alert.getId());
            throw new IncidentCreationException("Panic alert " + alert.getId()
                    + " was raised but the emergency incident could not be recorded");
        }
        return result;
    }

    /** Prompts an extra check-in right away. */
    public OperationResult requestCheckIn(String sessionId) {
        return withContext(sessionId, context -> checkInScheduler.prompt(context, CheckInType.PROMPTED)
                .map(checkIn -> OperationResult.success("Check-in " + checkIn.getId() + " prompted"))
                .orElseGet(() -> OperationResult.failure("Session " + sessionId + " is not active")));
    }

    public OperationResult respondToCheckIn(String sessionId, String checkInId, CheckInResponse response) {
        return withContext(sessionId, context -> checkInScheduler.respond(context, checkInId, response));
    }

    /**
     * Rider-initiated check-in. Without a location in the response, the latest fix is attached.
     */
    public OperationResult manualCheckIn(String sessionId, CheckInResponse response) {
        return withContext(sessionId, context -> {
            CheckInResponse withLocation = response;
            if (response.getLocation() == null) {
                RoutePoint lastFix = context.read(session -> session.lastFix().orElse(null));
                withLocation = CheckInResponse.builder()
                        .ok(response.isOk())
                        .message(response.getMessage())
                        .location(lastFix)
                        .build();
            }
            return checkInScheduler.manualCheckIn(context, withLocation);
        });
    }

    public OperationResult acknowledgeAlert(String sessionId, String alertId, String actor) {
        return withContext(sessionId, context -> context.execute(s -> alertEngine.acknowledge(s, alertId, actor)));
    }

    public OperationResult resolveAlert(String sessionId, String alertId, String actor) {
        return withContext(sessionId, context -> context.execute(s -> alertEngine.resolve(s, alertId, actor)));
    }

    public OperationResult markAlertFalseAlarm(String sessionId, String alertId, String actor) {
        return withContext(sessionId, context -> context.execute(s -> alertEngine.markFalseAlarm(s, alertId, actor)));
    }

    // ────────────────────────────────────────────────────────────────────────
    // Reads
    // ────────────────────────────────────────────────────────────────────────

    /** Detached JSON copy of a live session. */
    public Optional<JsonNode> view(String sessionId) {
        SessionContext context = sessions.get(sessionId);
        return context == null ? Optional.empty() : Optional.of(context.read(snapshotMapper::view));
    }

    public Optional<String> findSessionIdByRide(String rideId) {
        return sessions.values().stream()
                .filter(c -> c.getSession().getRideId().equals(rideId))
                .map(SessionContext::getSessionId)
                .findFirst();
    }

    public List<JsonNode> activeSessions() {
        return sessions.values().stream()
                .map(context -> context.read(snapshotMapper::view))
                .toList();
    }

    public boolean isMonitoring(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    private OperationResult withContext(String sessionId, Function<SessionContext, OperationResult> operation) {
        SessionContext context = sessions.get(sessionId);
        if (context == null) {
            return OperationResult.failure("No active monitoring session " + sessionId);
        }
        return operation.apply(context);
    }
}
