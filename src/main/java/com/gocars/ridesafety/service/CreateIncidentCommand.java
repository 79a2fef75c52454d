package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.IncidentType;
import lombok.Builder;
import lombok.Value;

/**
 * Input of {@link EmergencyIncidentManager#createIncident}.
 */
@Value
@Builder(toBuilder = true)
public class CreateIncidentCommand {

    String userId;

    /** Null for incidents raised outside a ride */
    String rideId;

    IncidentType type;

    /** Null when no position is known */
    Double latitude;
    Double longitude;
    Double accuracy;

    String description;

    /** Overrides the rider's discrete-mode setting when not null */
    Boolean discreteMode;

    /** Ask for emergency services even when auto-call is off; honored for CRITICAL priority only */
    boolean requestEmergencyServices;

    /** Who raised the incident: the rider's id, or "system" for escalated alerts */
    String triggeredBy;
}
