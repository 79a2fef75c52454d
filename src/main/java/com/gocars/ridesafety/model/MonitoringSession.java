package com.gocars.ridesafety.model;

import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One ride under safety observation.
 *
 * Mutated only while the owning {@code SessionContext} lock is held. {@code version} increases on
 * every committed update and orders the persistence writes of the session.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonitoringSession {

    private String id;
    private String rideId;
    private String userId;
    private String driverId;

    @Builder.Default
    private SessionStatus status = SessionStatus.MONITORING;

    private LocalDateTime startTime;
    private LocalDateTime endTime;

    @Builder.Default
    private List<RoutePoint> plannedRoute = new ArrayList<>();

    /** Append-only, time-ordered */
    @Builder.Default
    private List<RoutePoint> actualRoute = new ArrayList<>();

    @Builder.Default
    private List<RouteDeviation> deviations = new ArrayList<>();

    @Builder.Default
    private List<SafetyAlert> alerts = new ArrayList<>();

    @Builder.Default
    private List<SafetyCheckIn> checkIns = new ArrayList<>();

    @Builder.Default
    private DriverBehaviorMetrics behaviorMetrics = DriverBehaviorMetrics.initial();

    private double riskScore;

    @Builder.Default
    private boolean active = true;

    private long version;

    // Signal bookkeeping for communication loss and extended stops
    private int consecutiveMissedSamples;
    private boolean communicationLossAlerted;
    private LocalDateTime stoppedSince;
    private boolean extendedStopAlerted;

    public Optional<RoutePoint> lastFix() {
        return actualRoute.isEmpty()
                ? Optional.empty()
                : Optional.of(actualRoute.get(actualRoute.size() - 1));
    }

    public Optional<RouteDeviation> openDeviation() {
        return deviations.stream().filter(d -> !d.isResolved()).findFirst();
    }

    public Optional<SafetyAlert> findAlert(String alertId) {
        return alerts.stream().filter(a -> a.getId().equals(alertId)).findFirst();
    }

    public Optional<SafetyCheckIn> findCheckIn(String checkInId) {
        return checkIns.stream().filter(c -> c.getId().equals(checkInId)).findFirst();
    }

    /** Bumps and returns the write sequence; call once per committed update. */
    public long nextVersion() {
        return ++version;
    }
}
