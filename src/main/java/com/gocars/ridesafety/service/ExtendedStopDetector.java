package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.AlertSeverity;
import com.gocars.ridesafety.model.AlertType;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Flags a vehicle that stays stationary for too long during a ride. One EXTENDED_STOP alert per
 * stop; moving again re-arms the detector.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtendedStopDetector {

    private final RideSafetyProperties properties;

    public Optional<SafetySignal> evaluate(MonitoringSession session, RoutePoint fix) {
        Double speedKmh = speedKmh(session, fix);
        if (speedKmh == null) {
            return Optional.empty();
        }

        RideSafetyProperties.Stop config = properties.getStop();
        if (speedKmh >= config.getSpeedThresholdKmh()) {
            session.setStoppedSince(null);
            session.setExtendedStopAlerted(false);
            return Optional.empty();
        }

        LocalDateTime stoppedSince = session.getStoppedSince();
        if (stoppedSince == null) {
            session.setStoppedSince(fix.getTimestamp());
            return Optional.empty();
        }

        Duration stopped = Duration.between(stoppedSince, fix.getTimestamp());
        if (stopped.compareTo(config.getMaxDuration()) <= 0 || session.isExtendedStopAlerted()) {
            return Optional.empty();
        }

        session.setExtendedStopAlerted(true);
        log.info("Session {} stationary for {} min", session.getId(), stopped.toMinutes());
        return Optional.of(SafetySignal.builder()
                .type(AlertType.EXTENDED_STOP)
                .severity(AlertSeverity.LOW)
                .description(String.format("Vehicle has not moved for %d minutes", stopped.toMinutes()))
                .datum("stoppedSince", stoppedSince.toString())
                .datum("stoppedMinutes", stopped.toMinutes())
                .build());
    }

    /** Device speed if reported, otherwise computed from the last two fixes; null when unknown. */
    private Double speedKmh(MonitoringSession session, RoutePoint fix) {
        if (fix.getSpeed() != null) {
            return GeoUtil.metersPerSecondToKmh(fix.getSpeed());
        }
        List<RoutePoint> route = session.getActualRoute();
        if (route.size() < 2) {
            return null;
        }
        RoutePoint previous = route.get(route.size() - 2);
        if (GeoUtil.secondsBetween(previous, fix) <= 0) {
            return null;
        }
        return GeoUtil.metersPerSecondToKmh(GeoUtil.speedBetween(previous, fix));
    }
}
