package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.model.EmergencyIncident;

import java.time.Duration;

/**
 * Audio and photo capture on the rider's device during an incident.
 */
public interface EvidenceCaptureGateway {

    void startAudioRecording(EmergencyIncident incident, Duration maxDuration);

    void capturePhotos(EmergencyIncident incident);
}
