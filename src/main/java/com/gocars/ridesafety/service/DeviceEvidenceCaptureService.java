package com.gocars.ridesafety.service;

import com.gocars.ridesafety.gateway.EvidenceCaptureGateway;
import com.gocars.ridesafety.model.EmergencyIncident;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * Default {@link EvidenceCaptureGateway}: capture runs on the rider's device, so this sends the
 * capture command to the rider app over WebSocket.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceEvidenceCaptureService implements EvidenceCaptureGateway {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void startAudioRecording(EmergencyIncident incident, Duration maxDuration) {
        log.info("Audio recording requested for incident {} (max {}s)", incident.getId(), maxDuration.getSeconds());
        messagingTemplate.convertAndSend(captureTopic(incident), Map.of(
                "incidentId", incident.getId(),
                "command", "START_AUDIO_RECORDING",
                "maxDurationSeconds", maxDuration.getSeconds()));
    }

    @Override
    public void capturePhotos(EmergencyIncident incident) {
        log.info("Photo capture requested for incident {}", incident.getId());
        messagingTemplate.convertAndSend(captureTopic(incident), Map.of(
                "incidentId", incident.getId(),
                "command", "CAPTURE_PHOTOS"));
    }

    private String captureTopic(EmergencyIncident incident) {
        return "/topic/users/" + incident.getUserId() + "/evidence";
    }
}
