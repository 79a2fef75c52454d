package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.MonitoringSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * End of every session update step: recompute risk, snapshot under the lock, write asynchronously
 * and push the new state to dashboards.
 */
@Component
@RequiredArgsConstructor
public class SessionCommitListener implements SessionUpdateListener {

    private final RiskAggregator riskAggregator;
    private final SnapshotMapper snapshotMapper;
    private final SafetyPersistenceService persistenceService;
    private final SafetyEventPublisher eventPublisher;

    @Override
    public void onSessionUpdated(MonitoringSession session) {
        riskAggregator.apply(session);
        snapshotMapper.snapshot(session).ifPresent(persistenceService::persistSession);
        eventPublisher.publishSessionUpdate(session);
    }
}
