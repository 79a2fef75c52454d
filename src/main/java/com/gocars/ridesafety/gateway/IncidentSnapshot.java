package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.model.IncidentPriority;
import com.gocars.ridesafety.model.IncidentStatus;
import com.gocars.ridesafety.model.IncidentType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class IncidentSnapshot {

    String id;
    String userId;
    String rideId;
    IncidentType type;
    IncidentStatus status;
    IncidentPriority priority;
    long version;
    String document;
    LocalDateTime takenAt;
}
