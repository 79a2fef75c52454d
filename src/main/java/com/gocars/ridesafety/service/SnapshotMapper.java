package com.gocars.ridesafety.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocars.ridesafety.gateway.IncidentSnapshot;
import com.gocars.ridesafety.gateway.SessionSnapshot;
import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.model.MonitoringSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Turns live sessions and incidents into immutable JSON snapshots.
 *
 * Callers hold the owning lock, so the document and the version always describe the same state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotMapper {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Optional<SessionSnapshot> snapshot(MonitoringSession session) {
        try {
            return Optional.of(SessionSnapshot.builder()
                    .id(session.getId())
                    .rideId(session.getRideId())
                    .userId(session.getUserId())
                    .status(session.getStatus())
                    .riskScore(session.getRiskScore())
                    .active(session.isActive())
                    .version(session.getVersion())
                    .document(objectMapper.writeValueAsString(session))
                    .takenAt(LocalDateTime.now(clock))
                    .build());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize session {} v{} — write skipped", session.getId(), session.getVersion(), e);
            return Optional.empty();
        }
    }

    public Optional<IncidentSnapshot> snapshot(EmergencyIncident incident) {
        try {
            return Optional.of(IncidentSnapshot.builder()
                    .id(incident.getId())
                    .userId(incident.getUserId())
                    .rideId(incident.getRideId())
                    .type(incident.getType())
                    .status(incident.getStatus())
                    .priority(incident.getPriority())
                    .version(incident.getVersion())
                    .document(objectMapper.writeValueAsString(incident))
                    .takenAt(LocalDateTime.now(clock))
                    .build());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize incident {} v{} — write skipped", incident.getId(), incident.getVersion(), e);
            return Optional.empty();
        }
    }

    /** Detached JSON view for API responses, so no live object leaves its lock. */
    public JsonNode view(Object value) {
        return objectMapper.valueToTree(value);
    }
}
