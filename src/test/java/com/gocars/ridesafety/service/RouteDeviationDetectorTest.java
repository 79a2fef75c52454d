package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.AlertType;
import com.gocars.ridesafety.model.DeviationSeverity;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RouteDeviation;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.model.SafetySettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Deviation episodes against a straight planned route running due east along the equator.
 */
class RouteDeviationDetectorTest {

    private static final double METERS_PER_DEGREE = 111194.93;
    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 9, 0);

    private RideSafetyProperties properties;
    private RouteDeviationDetector detector;
    private MonitoringSession session;
    private SafetySettings settings;

    @BeforeEach
    void setUp() {
        properties = new RideSafetyProperties();
        detector = new RouteDeviationDetector(properties);
        session = MonitoringSession.builder()
                .id("session-1")
                .rideId("ride-1")
                .userId("user-1")
                .plannedRoute(new ArrayList<>(List.of(
                        RoutePoint.of(0, 0, T0),
                        RoutePoint.of(0, 0.05, T0))))
                .build();
        settings = SafetySettings.defaults("user-1").toBuilder()
                .routeDeviationThreshold(250)
                .build();
    }

    /** A fix {@code metersNorth} off the route, {@code seconds} after T0 */
    private RoutePoint offRoute(double metersNorth, int seconds) {
        return RoutePoint.of(metersNorth / METERS_PER_DEGREE, 0.02, T0.plusSeconds(seconds));
    }

    // ── Episodes ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("On-route fix opens nothing")
    void onRoute_noEpisode() {
        Optional<SafetySignal> signal = detector.evaluate(session, offRoute(20, 10), settings);

        assertThat(signal).isEmpty();
        assertThat(session.getDeviations()).isEmpty();
    }

    @Test
    @DisplayName("Fix beyond twice the threshold opens a MAJOR episode and alerts once")
    void farOffRoute_majorAndSingleAlert() {
        Optional<SafetySignal> first = detector.evaluate(session, offRoute(600, 10), settings);
        Optional<SafetySignal> second = detector.evaluate(session, offRoute(700, 40), settings);

        assertThat(first).isPresent();
        assertThat(first.get().getType()).isEqualTo(AlertType.ROUTE_DEVIATION);
        assertThat(second).isEmpty();

        assertThat(session.getDeviations()).hasSize(1);
        RouteDeviation deviation = session.getDeviations().get(0);
        assertThat(deviation.getSeverity()).isEqualTo(DeviationSeverity.MAJOR);
        assertThat(deviation.isAlertTriggered()).isTrue();
        assertThat(deviation.getDistanceFromRoute()).isCloseTo(700, within(2.0));
        assertThat(deviation.getDurationSeconds()).isEqualTo(30);
    }

    @Test
    @DisplayName("Back within the threshold resolves the open episode at the fix time")
    void backOnRoute_resolves() {
        detector.evaluate(session, offRoute(600, 10), settings);

        Optional<SafetySignal> signal = detector.evaluate(session, offRoute(100, 70), settings);

        assertThat(signal).isEmpty();
        RouteDeviation deviation = session.getDeviations().get(0);
        assertThat(deviation.isResolved()).isTrue();
        assertThat(deviation.getResolvedAt()).isEqualTo(T0.plusSeconds(70));
        assertThat(session.openDeviation()).isEmpty();
    }

    @Test
    @DisplayName("Episode that opens MINOR keeps its severity and never alerts while it grows")
    void minorThenMajor() {
        Optional<SafetySignal> minor = detector.evaluate(session, offRoute(300, 10), settings);

        assertThat(minor).isEmpty();
        assertThat(session.getDeviations().get(0).getSeverity()).isEqualTo(DeviationSeverity.MINOR);

        Optional<SafetySignal> further = detector.evaluate(session, offRoute(550, 20), settings);

        assertThat(further).isEmpty();
        assertThat(session.getDeviations()).hasSize(1);
        RouteDeviation deviation = session.getDeviations().get(0);
        assertThat(deviation.getSeverity()).isEqualTo(DeviationSeverity.MINOR);
        assertThat(deviation.isAlertTriggered()).isFalse();
        assertThat(deviation.getDistanceFromRoute()).isCloseTo(550, within(2.0));
        assertThat(deviation.getDurationSeconds()).isEqualTo(10);
    }

    @Test
    @DisplayName("Leaving the route again after a resolution opens a second episode")
    void secondEpisode() {
        detector.evaluate(session, offRoute(300, 10), settings);
        detector.evaluate(session, offRoute(0, 20), settings);
        detector.evaluate(session, offRoute(300, 30), settings);

        assertThat(session.getDeviations()).hasSize(2);
        assertThat(session.getDeviations().stream().filter(d -> !d.isResolved())).hasSize(1);
    }

    @Test
    @DisplayName("No planned route means nothing to deviate from")
    void emptyPlannedRoute() {
        session.setPlannedRoute(new ArrayList<>());

        assertThat(detector.evaluate(session, offRoute(5000, 10), settings)).isEmpty();
        assertThat(session.getDeviations()).isEmpty();
    }

    @Test
    @DisplayName("Vertex matching ignores the segment between far-apart points")
    void vertexMatchMode() {
        properties.getDeviation().setMatchMode(RideSafetyProperties.MatchMode.VERTEX);

        double distance = detector.distanceFromRoute(offRoute(0, 10), session.getPlannedRoute());

        // 0.02° east of the first vertex, ≈ 2.2 km
        assertThat(distance).isCloseTo(0.02 * METERS_PER_DEGREE, within(1.0));
    }

    @Test
    void resolveOpenDeviation_noOpenEpisode_isNoOp() {
        detector.resolveOpenDeviation(session, offRoute(0, 10));

        assertThat(session.getDeviations()).isEmpty();
    }
}
