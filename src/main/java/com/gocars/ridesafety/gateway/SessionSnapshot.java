package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.model.SessionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Immutable copy of a monitoring session taken under the session lock: the indexed columns
 * plus the full JSON document.
 */
@Value
@Builder
public class SessionSnapshot {

    String id;
    String rideId;
    String userId;
    SessionStatus status;
    double riskScore;
    boolean active;
    long version;
    String document;
    LocalDateTime takenAt;
}
