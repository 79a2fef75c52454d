package com.gocars.ridesafety.service;

import com.gocars.ridesafety.gateway.NotificationChannels;
import com.gocars.ridesafety.model.AlertAction;
import com.gocars.ridesafety.model.AlertActionType;
import com.gocars.ridesafety.model.AlertSeverity;
import com.gocars.ridesafety.model.AlertStatus;
import com.gocars.ridesafety.model.AlertType;
import com.gocars.ridesafety.model.EmergencyContact;
import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.model.EmergencySettings;
import com.gocars.ridesafety.model.IncidentType;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.model.SafetyAlert;
import com.gocars.ridesafety.model.SafetySettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.UUID;

/**
 * Raises safety alerts and runs their response actions.
 *
 * Action tiers by severity:
 *  - every alert       : NOTIFICATION_SENT to the rider
 *  - MEDIUM and HIGH   : CONTACT_NOTIFIED per active SMS contact, if the rider opted in
 *  - CRITICAL          : EMERGENCY_DISPATCHED, escalating to an emergency incident
 *
 * Each action is attempted on its own and recorded with its outcome; a failing channel never
 * stops the next one.
 *
 * State machine: ACTIVE → ACKNOWLEDGED | RESOLVED | FALSE_ALARM. Only ACTIVE alerts transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SafetyAlertEngine {

    static final String SYSTEM_ACTOR = "system";

    private final NotificationChannels notificationChannels;
    private final SettingsResolver settingsResolver;
    private final EmergencyIncidentManager incidentManager;
    private final SafetyEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Must be called with the session lock held.
     */
    public SafetyAlert raise(MonitoringSession session, SafetySignal signal) {
        SafetyAlert alert = SafetyAlert.builder()
                .id("alert_" + UUID.randomUUID())
                .type(signal.getType())
                .severity(signal.getSeverity())
                .triggeredAt(now())
                .location(session.lastFix().orElse(null))
                .description(signal.getDescription())
                .data(new LinkedHashMap<>(signal.getData()))
                .build();
        session.getAlerts().add(alert);
        log.info("==> {} alert [{}] raised for session {} (ride {}): {}",
                alert.getType(), alert.getSeverity(), session.getId(), session.getRideId(), alert.getDescription());

        notifyRider(session, alert);
        if (alert.getSeverity() == AlertSeverity.MEDIUM || alert.getSeverity() == AlertSeverity.HIGH) {
            notifyContacts(session, alert);
        }
        if (alert.getSeverity() == AlertSeverity.CRITICAL) {
            escalate(session, alert);
        }

        eventPublisher.publishAlert(session, alert);
        return alert;
    }

    public OperationResult acknowledge(MonitoringSession session, String alertId, String actor) {
        return transition(session, alertId, AlertStatus.ACKNOWLEDGED, actor);
    }

    public OperationResult resolve(MonitoringSession session, String alertId, String actor) {
        return transition(session, alertId, AlertStatus.RESOLVED, actor);
    }

    public OperationResult markFalseAlarm(MonitoringSession session, String alertId, String actor) {
        return transition(session, alertId, AlertStatus.FALSE_ALARM, actor);
    }

    private OperationResult transition(MonitoringSession session, String alertId, AlertStatus target, String actor) {
        Optional<SafetyAlert> found = session.findAlert(alertId);
        if (found.isEmpty()) {
            return OperationResult.failure("Alert " + alertId + " not found in session " + session.getId());
        }
        SafetyAlert alert = found.get();
        if (!alert.isActive()) {
            return OperationResult.failure("Alert " + alertId + " is already " + alert.getStatus());
        }

        LocalDateTime now = now();
        alert.setStatus(target);
        if (target == AlertStatus.ACKNOWLEDGED) {
            alert.setAcknowledgedBy(actor);
            alert.setAcknowledgedAt(now);
        } else {
            alert.setResolvedAt(now);
        }
        log.info("Alert {} of session {} is now {} ({})", alertId, session.getId(), target, actor);
        return OperationResult.success("Alert " + alertId + " is " + target);
    }

    // ────────────────────────────────────────────────────────────────────────
    // Response actions
    // ────────────────────────────────────────────────────────────────────────

    private void notifyRider(MonitoringSession session, SafetyAlert alert) {
        try {
            notificationChannels.notifyUser(session.getUserId(), title(alert.getType()), alert.getDescription());
            record(alert, AlertActionType.NOTIFICATION_SENT, "Rider notified", true);
        } catch (RuntimeException e) {
            log.error("Alert {} — rider notification failed: {}", alert.getId(), e.getMessage());
            record(alert, AlertActionType.NOTIFICATION_SENT, "Rider notification failed: " + e.getMessage(), false);
        }
    }

    private void notifyContacts(MonitoringSession session, SafetyAlert alert) {
        SafetySettings safetySettings = settingsResolver.safetySettings(session.getUserId());
        if (!safetySettings.isEmergencyContactsOnAlert()) {
            return;
        }
        EmergencySettings emergencySettings = settingsResolver.emergencySettings(session.getUserId());
        String text = "GoCars safety alert: " + alert.getDescription()
                + ". Ride " + session.getRideId() + " is being monitored.";

        for (EmergencyContact contact : emergencySettings.activeContacts()) {
            if (!contact.isSmsEnabled()) {
                continue;
            }
            try {
                notificationChannels.sendSms(contact.getPhoneNumber(), text);
                record(alert, AlertActionType.CONTACT_NOTIFIED, "SMS sent to " + contact.getName(), true);
            } catch (RuntimeException e) {
                log.error("Alert {} — SMS to contact {} failed: {}", alert.getId(), contact.getId(), e.getMessage());
                record(alert, AlertActionType.CONTACT_NOTIFIED,
                        "SMS to " + contact.getName() + " failed: " + e.getMessage(), false);
            }
        }
    }

    private void escalate(MonitoringSession session, SafetyAlert alert) {
        RoutePoint location = alert.getLocation();
        try {
            EmergencyIncident incident = incidentManager.createIncident(CreateIncidentCommand.builder()
                    .userId(session.getUserId())
                    .rideId(session.getRideId())
                    .type(incidentTypeFor(alert.getType()))
                    .latitude(location != null ? location.getLatitude() : null)
                    .longitude(location != null ? location.getLongitude() : null)
                    .accuracy(location != null ? location.getAccuracy() : null)
                    .description(alert.getDescription())
                    .requestEmergencyServices(true)
                    .triggeredBy(SYSTEM_ACTOR)
                    .build());
            alert.getData().put("incidentId", incident.getId());
            record(alert, AlertActionType.EMERGENCY_DISPATCHED, "Emergency incident " + incident.getId() + " created", true);
        } catch (RuntimeException e) {
            log.error("Alert {} — escalation to an emergency incident failed", alert.getId(), e);
            record(alert, AlertActionType.EMERGENCY_DISPATCHED, "Escalation failed: " + e.getMessage(), false);
        }
    }

    /** Escalated alerts always map to a CRITICAL incident type. */
    static IncidentType incidentTypeFor(AlertType alertType) {
        return alertType == AlertType.HARSH_DRIVING ? IncidentType.ACCIDENT : IncidentType.SOS;
    }

    private void record(SafetyAlert alert, AlertActionType type, String details, boolean success) {
        alert.getActions().add(AlertAction.builder()
                .id("action_" + UUID.randomUUID())
                .type(type)
                .timestamp(now())
                .actor(SYSTEM_ACTOR)
                .details(details)
                .success(success)
                .build());
    }

    private String title(AlertType type) {
        if (type == AlertType.ROUTE_DEVIATION) return "Route deviation detected";
        if (type == AlertType.SPEED_VIOLATION) return "Speeding detected";
        if (type == AlertType.HARSH_DRIVING) return "Harsh driving detected";
        if (type == AlertType.CHECK_IN_MISSED) return "Safety check-in";
        if (type == AlertType.PANIC_BUTTON) return "Panic alert sent";
        if (type == AlertType.COMMUNICATION_LOSS) return "Location signal lost";
        return "Vehicle stopped";
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
