package com.gocars.ridesafety.service;

import com.gocars.ridesafety.gateway.IncidentSnapshot;
import com.gocars.ridesafety.gateway.PersistenceResult;
import com.gocars.ridesafety.gateway.SafetyRecordStore;
import com.gocars.ridesafety.gateway.SessionSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Hands snapshots to the {@link SafetyRecordStore}.
 *
 * The async writes run on "persistenceTaskExecutor" so a slow store never delays the next
 * sampling cycle. Ordering is left to the store: every snapshot carries the version it was taken
 * at and older versions are dropped there.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SafetyPersistenceService {

    private final SafetyRecordStore recordStore;

    @Async("persistenceTaskExecutor")
    public void persistSession(SessionSnapshot snapshot) {
        PersistenceResult result = recordStore.upsertSession(snapshot);
        report("session", snapshot.getId(), snapshot.getVersion(), result);
    }

    @Async("persistenceTaskExecutor")
    public void persistIncident(IncidentSnapshot snapshot) {
        PersistenceResult result = recordStore.upsertIncident(snapshot);
        report("incident", snapshot.getId(), snapshot.getVersion(), result);
    }

    /**
     * Synchronous write, used for the first record of an incident: the caller must know whether
     * the emergency was recorded.
     */
    public PersistenceResult persistIncidentNow(IncidentSnapshot snapshot) {
        PersistenceResult result = recordStore.upsertIncident(snapshot);
        report("incident", snapshot.getId(), snapshot.getVersion(), result);
        return result;
    }

    private void report(String kind, String id, long version, PersistenceResult result) {
        if (result.getOutcome() == PersistenceResult.Outcome.FAILED) {
            log.error("Persisting {} {} v{} failed: {}", kind, id, version, result.getError());
        } else if (result.getOutcome() == PersistenceResult.Outcome.STALE) {
            log.debug("Skipped stale {} write {} v{}", kind, id, version);
        } else {
            log.debug("Persisted {} {} v{}", kind, id, version);
        }
    }
}
