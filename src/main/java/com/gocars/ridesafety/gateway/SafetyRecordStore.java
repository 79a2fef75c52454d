package com.gocars.ridesafety.gateway;

/**
 * Durable store for session and incident documents, keyed by id.
 *
 * Never throws: every failure comes back as a {@link PersistenceResult}. A snapshot whose version
 * is not newer than the stored one is ignored, so a delayed write cannot overwrite a later one.
 */
public interface SafetyRecordStore {

    PersistenceResult upsertSession(SessionSnapshot snapshot);

    PersistenceResult upsertIncident(IncidentSnapshot snapshot);
}
