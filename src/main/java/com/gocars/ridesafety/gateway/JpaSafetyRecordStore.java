package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.entity.EmergencyIncidentRecord;
import com.gocars.ridesafety.entity.MonitoringSessionRecord;
import com.gocars.ridesafety.repository.EmergencyIncidentRecordRepository;
import com.gocars.ridesafety.repository.MonitoringSessionRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Default {@link SafetyRecordStore} over JPA.
 *
 * Each upsert runs in its own transaction:
 *   1. load the row with a PESSIMISTIC_WRITE lock
 *   2. stored version ≥ snapshot version → STALE, nothing written
 *   3. otherwise insert or overwrite the row
 *
 * The transaction is driven through a TransactionTemplate so that commit-time failures are
 * caught here as well and come back as FAILED instead of escaping the caller.
 */
@Service
@Slf4j
public class JpaSafetyRecordStore implements SafetyRecordStore {

    private final MonitoringSessionRecordRepository sessionRepository;
    private final EmergencyIncidentRecordRepository incidentRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaSafetyRecordStore(MonitoringSessionRecordRepository sessionRepository,
                                EmergencyIncidentRecordRepository incidentRepository,
                                PlatformTransactionManager transactionManager) {
        this.sessionRepository = sessionRepository;
        this.incidentRepository = incidentRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public PersistenceResult upsertSession(SessionSnapshot snapshot) {
        return inTransaction("session " + snapshot.getId(), () -> {
            Optional<MonitoringSessionRecord> existing = sessionRepository.findByIdForUpdate(snapshot.getId());
            if (existing.isPresent() && existing.get().getVersion() >= snapshot.getVersion()) {
                return PersistenceResult.stale();
            }
            MonitoringSessionRecord record = existing.orElseGet(MonitoringSessionRecord::new);
            record.setId(snapshot.getId());
            record.setRideId(snapshot.getRideId());
            record.setUserId(snapshot.getUserId());
            record.setStatus(snapshot.getStatus());
            record.setRiskScore(snapshot.getRiskScore());
            record.setActive(snapshot.isActive());
            record.setVersion(snapshot.getVersion());
            record.setDocument(snapshot.getDocument());
            record.setUpdatedAt(snapshot.getTakenAt());
            sessionRepository.save(record);
            return PersistenceResult.written();
        });
    }

    @Override
    public PersistenceResult upsertIncident(IncidentSnapshot snapshot) {
        return inTransaction("incident " + snapshot.getId(), () -> {
            Optional<EmergencyIncidentRecord> existing = incidentRepository.findByIdForUpdate(snapshot.getId());
            if (existing.isPresent() && existing.get().getVersion() >= snapshot.getVersion()) {
                return PersistenceResult.stale();
            }
            EmergencyIncidentRecord record = existing.orElseGet(EmergencyIncidentRecord::new);
            record.setId(snapshot.getId());
            record.setUserId(snapshot.getUserId());
            record.setRideId(snapshot.getRideId());
            record.setType(snapshot.getType());
            record.setStatus(snapshot.getStatus());
            record.setPriority(snapshot.getPriority());
            record.setVersion(snapshot.getVersion());
            record.setDocument(snapshot.getDocument());
            record.setUpdatedAt(snapshot.getTakenAt());
            incidentRepository.save(record);
            return PersistenceResult.written();
        });
    }

    private PersistenceResult inTransaction(String what, Supplier<PersistenceResult> work) {
        try {
            PersistenceResult result = transactionTemplate.execute(status -> work.get());
            return result != null ? result : PersistenceResult.failed("No result for " + what);
        } catch (RuntimeException e) {
            log.error("Upsert of {} failed: {}", what, e.getMessage());
            return PersistenceResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
