package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.model.SafetyAlert;
import com.gocars.ridesafety.model.SafetyCheckIn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Live push to dashboards and rider apps over STOMP.
 *
 * Topics:
 *  /topic/ride-safety/{rideId}          - session state after every committed update
 *  /topic/ride-safety/{rideId}/alerts   - each new alert
 *  /topic/users/{userId}/check-ins      - check-in prompts for the rider app
 *  /topic/incidents                     - incident lifecycle events for the operations desk
 *
 * A push failure is logged and dropped; it never interrupts monitoring.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SafetyEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    public void publishSessionUpdate(MonitoringSession session) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("rideId", session.getRideId());
        payload.put("status", session.getStatus().name());
        payload.put("active", session.isActive());
        payload.put("riskScore", session.getRiskScore());
        payload.put("behaviorScore", session.getBehaviorMetrics().getOverallScore());
        payload.put("behaviorRiskLevel", session.getBehaviorMetrics().getRiskLevel().name());
        payload.put("activeAlerts", session.getAlerts().stream().filter(SafetyAlert::isActive).count());
        payload.put("offRoute", session.openDeviation().isPresent());
        payload.put("version", session.getVersion());
        session.lastFix().ifPresent(fix -> {
            payload.put("latitude", fix.getLatitude());
            payload.put("longitude", fix.getLongitude());
            payload.put("fixTime", fix.getTimestamp().toString());
        });
        send("/topic/ride-safety/" + session.getRideId(), payload);
    }

    public void publishAlert(MonitoringSession session, SafetyAlert alert) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("rideId", session.getRideId());
        payload.put("alertId", alert.getId());
        payload.put("type", alert.getType().name());
        payload.put("severity", alert.getSeverity().name());
        payload.put("status", alert.getStatus().name());
        payload.put("description", alert.getDescription());
        payload.put("triggeredAt", alert.getTriggeredAt().toString());
        RoutePoint location = alert.getLocation();
        if (location != null) {
            payload.put("latitude", location.getLatitude());
            payload.put("longitude", location.getLongitude());
        }
        send("/topic/ride-safety/" + session.getRideId() + "/alerts", payload);
    }

    public void publishCheckInPrompt(MonitoringSession session, SafetyCheckIn checkIn) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("rideId", session.getRideId());
        payload.put("checkInId", checkIn.getId());
        payload.put("type", checkIn.getType().name());
        payload.put("deadline", checkIn.getDeadline().toString());
        send("/topic/users/" + session.getUserId() + "/check-ins", payload);
    }

    public void publishIncident(String event, EmergencyIncident incident) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("event", event);
        payload.put("incidentId", incident.getId());
        payload.put("userId", incident.getUserId());
        payload.put("rideId", incident.getRideId());
        payload.put("type", incident.getType().name());
        payload.put("priority", incident.getPriority().name());
        payload.put("status", incident.getStatus().name());
        payload.put("responders", incident.getResponders().size());
        if (incident.getLocation() != null) {
            payload.put("latitude", incident.getLocation().getLatitude());
            payload.put("longitude", incident.getLocation().getLongitude());
        }
        send("/topic/incidents", payload);
    }

    private void send(String destination, Map<String, Object> payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            log.warn("WebSocket push to {} failed: {}", destination, e.getMessage());
        }
    }
}
