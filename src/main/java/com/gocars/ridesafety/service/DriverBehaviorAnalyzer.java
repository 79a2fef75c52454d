package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.AlertType;
import com.gocars.ridesafety.model.DriverBehaviorMetrics;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RiskLevel;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.model.SafetySettings;
import com.gocars.ridesafety.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives speed, acceleration and turn rate from the latest fixes of a session and folds them
 * into its {@link DriverBehaviorMetrics}.
 *
 * Needs two fixes for speed and three for acceleration. The score is recomputed from the full
 * counter set after every fix, so replaying a fix sequence yields the same metrics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriverBehaviorAnalyzer {

    private final RideSafetyProperties properties;

    /**
     * Must be called with the session lock held, after the newest fix was appended.
     *
     * @return alerts for a speed violation and/or harsh driving on this fix
     */
    public List<SafetySignal> analyze(MonitoringSession session, SafetySettings settings) {
        List<RoutePoint> route = session.getActualRoute();
        int size = route.size();
        if (size < 2) {
            return List.of();
        }

        RoutePoint current = route.get(size - 1);
        RoutePoint previous = route.get(size - 2);
        double seconds = GeoUtil.secondsBetween(previous, current);
        if (seconds <= 0) {
            log.debug("Session {} fix at {} does not advance time — skipped", session.getId(), current.getTimestamp());
            return List.of();
        }

        RideSafetyProperties.Behavior config = properties.getBehavior();
        DriverBehaviorMetrics metrics = session.getBehaviorMetrics();
        List<SafetySignal> signals = new ArrayList<>();

        double computedSpeed = GeoUtil.speedBetween(previous, current);
        double speedKmh = GeoUtil.metersPerSecondToKmh(
                current.getSpeed() != null ? current.getSpeed() : computedSpeed);
        recordSpeed(metrics, speedKmh);

        double allowedKmh = config.getSpeedLimitKmh() * (1 + settings.getSpeedViolationTolerance() / 100.0);
        if (speedKmh > allowedKmh) {
            metrics.setSpeedViolations(metrics.getSpeedViolations() + 1);
            signals.add(SafetySignal.builder()
                    .type(AlertType.SPEED_VIOLATION)
                    .severity(config.getSpeedViolationSeverity())
                    .description(String.format("Speed %.0f km/h exceeds the %.0f km/h limit",
                            speedKmh, config.getSpeedLimitKmh()))
                    .datum("speedKmh", Math.round(speedKmh))
                    .datum("limitKmh", config.getSpeedLimitKmh())
                    .build());
        }

        RoutePoint beforePrevious = size >= 3 ? route.get(size - 3) : null;
        if (beforePrevious != null && GeoUtil.secondsBetween(beforePrevious, previous) > 0) {
            double previousSpeed = GeoUtil.speedBetween(beforePrevious, previous);
            double acceleration = (computedSpeed - previousSpeed) / seconds;
            if (Math.abs(acceleration) > config.getHarshAccelerationThreshold()) {
                boolean braking = acceleration < 0;
                if (braking) {
                    metrics.setHarshBraking(metrics.getHarshBraking() + 1);
                } else {
                    metrics.setHarshAccelerations(metrics.getHarshAccelerations() + 1);
                }
                signals.add(SafetySignal.builder()
                        .type(AlertType.HARSH_DRIVING)
                        .severity(config.getHarshDrivingSeverity())
                        .description(String.format("Harsh %s detected (%.1f m/s²)",
                                braking ? "braking" : "acceleration", Math.abs(acceleration)))
                        .datum("acceleration", acceleration)
                        .build());
            }
        }

        Double previousHeading = previous.getHeading() != null
                ? previous.getHeading()
                : beforePrevious != null ? Double.valueOf(GeoUtil.bearing(beforePrevious, previous)) : null;
        double currentHeading = current.getHeading() != null
                ? current.getHeading()
                : GeoUtil.bearing(previous, current);
        if (previousHeading != null
                && speedKmh > config.getSharpTurnMinSpeedKmh()
                && GeoUtil.headingDelta(previousHeading, currentHeading) > config.getSharpTurnDegrees()) {
            metrics.setSharpTurns(metrics.getSharpTurns() + 1);
        }

        rescore(metrics);
        log.debug("Session {} behavior — speed {} km/h, score {}, level {}",
                session.getId(), Math.round(speedKmh), metrics.getOverallScore(), metrics.getRiskLevel());
        return signals;
    }

    /**
     * Recomputes score and risk level from the counters alone.
     */
    void rescore(DriverBehaviorMetrics metrics) {
        RideSafetyProperties.Behavior config = properties.getBehavior();
        double score = 100
                - metrics.getSpeedViolations() * config.getSpeedViolationPenalty()
                - metrics.getHarshAccelerations() * config.getHarshAccelerationPenalty()
                - metrics.getHarshBraking() * config.getHarshBrakingPenalty()
                - metrics.getSharpTurns() * config.getSharpTurnPenalty();
        score = Math.max(0, Math.min(100, score));

        metrics.setOverallScore(score);
        metrics.setRiskLevel(riskLevel(score));
    }

    private RiskLevel riskLevel(double score) {
        RideSafetyProperties.Behavior config = properties.getBehavior();
        if (score >= config.getLowRiskScore()) return RiskLevel.LOW;
        if (score >= config.getMediumRiskScore()) return RiskLevel.MEDIUM;
        if (score >= config.getHighRiskScore()) return RiskLevel.HIGH;
        return RiskLevel.CRITICAL;
    }

    private void recordSpeed(DriverBehaviorMetrics metrics, double speedKmh) {
        long samples = metrics.getSpeedSamples() + 1;
        metrics.setAverageSpeed(metrics.getAverageSpeed() + (speedKmh - metrics.getAverageSpeed()) / samples);
        metrics.setSpeedSamples(samples);
        metrics.setMaxSpeed(Math.max(metrics.getMaxSpeed(), speedKmh));
    }
}
