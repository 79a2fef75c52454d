package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.AlertSeverity;
import com.gocars.ridesafety.model.CheckInStatus;
import com.gocars.ridesafety.model.DeviationSeverity;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.model.RouteDeviation;
import com.gocars.ridesafety.model.SafetyAlert;
import com.gocars.ridesafety.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Folds the current contents of a session into a 0–100 risk score and a coarse status.
 *
 * score = w1·open deviations + w2·open major deviations + w3·(100 − behavior score)
 *       + w4·active alerts + w5·active high alerts + w6·active critical alerts
 *       + w7·missed check-ins, clamped to [0, 100]
 *
 * No state of its own: the same session contents always give the same score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskAggregator {

    private final RideSafetyProperties properties;

    public double calculate(MonitoringSession session) {
        RideSafetyProperties.Risk weights = properties.getRisk();

        List<RouteDeviation> open = session.getDeviations().stream().filter(d -> !d.isResolved()).toList();
        long majorOpen = open.stream().filter(d -> d.getSeverity() == DeviationSeverity.MAJOR).count();

        List<SafetyAlert> activeAlerts = session.getAlerts().stream().filter(SafetyAlert::isActive).toList();
        long high = activeAlerts.stream().filter(a -> a.getSeverity() == AlertSeverity.HIGH).count();
        long critical = activeAlerts.stream().filter(a -> a.getSeverity() == AlertSeverity.CRITICAL).count();

        long missedCheckIns = session.getCheckIns().stream()
                .filter(c -> c.getStatus() == CheckInStatus.MISSED)
                .count();

        double score = open.size() * weights.getOpenDeviationWeight()
                + majorOpen * weights.getMajorDeviationWeight()
                + (100 - session.getBehaviorMetrics().getOverallScore()) * weights.getBehaviorWeight()
                + activeAlerts.size() * weights.getActiveAlertWeight()
                + high * weights.getHighAlertWeight()
                + critical * weights.getCriticalAlertWeight()
                + missedCheckIns * weights.getMissedCheckInWeight();

        return Math.max(0, Math.min(100, score));
    }

    /**
     * Stores the score on the session and derives its status. Completed sessions are left alone.
     */
    public void apply(MonitoringSession session) {
        if (!session.isActive() || session.getStatus() == SessionStatus.COMPLETED) {
            return;
        }
        double score = calculate(session);
        SessionStatus status = statusFor(score);
        if (status != session.getStatus()) {
            log.info("Session {} status {} -> {} (risk {})",
                    session.getId(), session.getStatus(), status, Math.round(score));
        }
        session.setRiskScore(score);
        session.setStatus(status);
    }

    private SessionStatus statusFor(double score) {
        RideSafetyProperties.Risk config = properties.getRisk();
        if (score > config.getEmergencyThreshold()) return SessionStatus.EMERGENCY;
        if (score > config.getAlertThreshold()) return SessionStatus.ALERT_TRIGGERED;
        return SessionStatus.MONITORING;
    }
}
