package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.config.RideSafetyProperties.MatchMode;
import com.gocars.ridesafety.model.AlertType;
import com.gocars.ridesafety.model.DeviationSeverity;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RouteDeviation;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.model.SafetySettings;
import com.gocars.ridesafety.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Compares each fix against the planned route and maintains deviation episodes.
 *
 * Rules:
 *  - distance > threshold                : extend the open episode, or open one
 *  - opening distance > threshold × mult : episode is MAJOR and raises ROUTE_DEVIATION once
 *  - distance ≤ threshold                : resolves the open episode, if any
 *
 * Severity is fixed when the episode opens; extending it only updates max distance and duration.
 * At most one episode is open per session. Timestamps come from the fixes so a replayed
 * sequence produces the same episodes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouteDeviationDetector {

    private final RideSafetyProperties properties;

    /**
     * Must be called with the session lock held, after the fix was appended to the actual route.
     *
     * @return the alert to raise, if this fix opened a major episode
     */
    public Optional<SafetySignal> evaluate(MonitoringSession session, RoutePoint fix, SafetySettings settings) {
        List<RoutePoint> plannedRoute = session.getPlannedRoute();
        if (plannedRoute == null || plannedRoute.isEmpty()) {
            return Optional.empty();
        }

        double threshold = settings.getRouteDeviationThreshold();
        double majorBound = threshold * properties.getDeviation().getMajorMultiplier();
        double distance = distanceFromRoute(fix, plannedRoute);
        Optional<RouteDeviation> open = session.openDeviation();

        if (distance <= threshold) {
            open.ifPresent(deviation -> {
                resolve(deviation, fix);
                log.info("Session {} back on route — deviation {} resolved after {}s (max {} m)",
                        session.getId(), deviation.getId(), deviation.getDurationSeconds(),
                        Math.round(deviation.getDistanceFromRoute()));
            });
            return Optional.empty();
        }

        RouteDeviation deviation = open.orElseGet(() -> openEpisode(session, fix,
                distance > majorBound ? DeviationSeverity.MAJOR : DeviationSeverity.MINOR));
        deviation.setDistanceFromRoute(Math.max(deviation.getDistanceFromRoute(), distance));
        deviation.setDurationSeconds(Math.max(0,
                Duration.between(deviation.getDetectedAt(), fix.getTimestamp()).getSeconds()));
        deviation.setLocation(fix);

        if (open.isEmpty() && deviation.getSeverity() == DeviationSeverity.MAJOR && !deviation.isAlertTriggered()) {
            deviation.setAlertTriggered(true);
            return Optional.of(SafetySignal.builder()
                    .type(AlertType.ROUTE_DEVIATION)
                    .severity(properties.getDeviation().getAlertSeverity())
                    .description(String.format("Vehicle is %d m off the planned route",
                            Math.round(deviation.getDistanceFromRoute())))
                    .datum("deviationId", deviation.getId())
                    .datum("distanceMeters", Math.round(deviation.getDistanceFromRoute()))
                    .datum("thresholdMeters", Math.round(threshold))
                    .build());
        }
        return Optional.empty();
    }

    /**
     * Resolves the open episode, if any. A no-op when nothing is open.
     */
    public void resolveOpenDeviation(MonitoringSession session, RoutePoint at) {
        session.openDeviation().ifPresent(deviation -> resolve(deviation, at));
    }

    double distanceFromRoute(RoutePoint fix, List<RoutePoint> plannedRoute) {
        return properties.getDeviation().getMatchMode() == MatchMode.VERTEX
                ? GeoUtil.distanceToNearestVertex(fix, plannedRoute)
                : GeoUtil.distanceToPolyline(fix, plannedRoute);
    }

    private RouteDeviation openEpisode(MonitoringSession session, RoutePoint fix, DeviationSeverity severity) {
        RouteDeviation deviation = RouteDeviation.builder()
                .id("deviation_" + UUID.randomUUID())
                .detectedAt(fix.getTimestamp())
                .severity(severity)
                .location(fix)
                .build();
        session.getDeviations().add(deviation);
        log.info("Session {} left the planned route — {} deviation {} opened",
                session.getId(), severity, deviation.getId());
        return deviation;
    }

    private void resolve(RouteDeviation deviation, RoutePoint at) {
        if (deviation.isResolved()) {
            return;
        }
        deviation.setResolved(true);
        deviation.setResolvedAt(at != null ? at.getTimestamp() : null);
    }
}
