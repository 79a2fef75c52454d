package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RiskAggregatorTest {

    private RiskAggregator aggregator;
    private MonitoringSession session;

    @BeforeEach
    void setUp() {
        aggregator = new RiskAggregator(new RideSafetyProperties());
        session = MonitoringSession.builder().id("session-1").rideId("ride-1").userId("user-1").build();
    }

    private SafetyAlert alert(AlertSeverity severity, AlertStatus status) {
        return SafetyAlert.builder().id("a-" + severity + status).type(AlertType.PANIC_BUTTON)
                .severity(severity).status(status).build();
    }

    private RouteDeviation deviation(DeviationSeverity severity, boolean resolved) {
        return RouteDeviation.builder().id("d").severity(severity).resolved(resolved).build();
    }

    @Test
    @DisplayName("Quiet session scores zero and stays MONITORING")
    void quietSession() {
        aggregator.apply(session);

        assertThat(session.getRiskScore()).isZero();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.MONITORING);
    }

    @Test
    @DisplayName("Each term contributes its weight")
    void weightedTerms() {
        session.getDeviations().add(deviation(DeviationSeverity.MAJOR, false));    // 10 + 20
        session.getDeviations().add(deviation(DeviationSeverity.MINOR, true));     // resolved: 0
        session.getBehaviorMetrics().setOverallScore(90);                            // 10 × 0.5
        session.getAlerts().add(alert(AlertSeverity.HIGH, AlertStatus.ACTIVE));     // 5 + 15
        session.getAlerts().add(alert(AlertSeverity.CRITICAL, AlertStatus.RESOLVED)); // inactive: 0

        assertThat(aggregator.calculate(session)).isCloseTo(55, within(1e-9));
    }

    @Test
    @DisplayName("Only MISSED check-ins count, a late answer clears the penalty")
    void missedCheckIns() {
        session.getCheckIns().add(SafetyCheckIn.builder().id("c1").status(CheckInStatus.MISSED).build());
        session.getCheckIns().add(SafetyCheckIn.builder().id("c2").status(CheckInStatus.OVERDUE).build());

        assertThat(aggregator.calculate(session)).isCloseTo(25, within(1e-9));
    }

    @Test
    @DisplayName("Score is clamped to 100 and switches the session to EMERGENCY")
    void clampedToHundred() {
        for (int i = 0; i < 4; i++) {
            session.getAlerts().add(alert(AlertSeverity.CRITICAL, AlertStatus.ACTIVE));
        }

        aggregator.apply(session);

        assertThat(session.getRiskScore()).isEqualTo(100);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.EMERGENCY);
    }

    @Test
    @DisplayName("Score above 50 raises ALERT_TRIGGERED and falls back once alerts are resolved")
    void alertTriggeredThenDeescalates() {
        SafetyAlert critical = alert(AlertSeverity.CRITICAL, AlertStatus.ACTIVE);
        session.getAlerts().add(critical);                                   // 35
        session.getCheckIns().add(SafetyCheckIn.builder().id("c").status(CheckInStatus.MISSED).build()); // 25

        aggregator.apply(session);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ALERT_TRIGGERED);

        critical.setStatus(AlertStatus.RESOLVED);
        aggregator.apply(session);
        assertThat(session.getRiskScore()).isCloseTo(25, within(1e-9));
        assertThat(session.getStatus()).isEqualTo(SessionStatus.MONITORING);
    }

    @Test
    @DisplayName("Completed sessions keep their final status")
    void completedSessionUntouched() {
        session.setActive(false);
        session.setStatus(SessionStatus.COMPLETED);
        session.getAlerts().add(alert(AlertSeverity.CRITICAL, AlertStatus.ACTIVE));

        aggregator.apply(session);

        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.getRiskScore()).isZero();
    }
}
