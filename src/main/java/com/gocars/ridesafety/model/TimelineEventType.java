package com.gocars.ridesafety.model;

/**
 * Entry kinds of the append-only incident timeline.
 */
public enum TimelineEventType {
    INCIDENT_CREATED,
    LOCATION_TRACKING_STARTED,
    CONTACTS_NOTIFIED,
    SERVICES_CONTACTED,
    RESPONDER_ASSIGNED,
    EVIDENCE_CAPTURE_STARTED,
    DRIVER_NOTIFIED,
    STATUS_UPDATE,

    /** A creation-workflow step failed; later steps still ran */
    STEP_FAILED,

    RESOLVED
}
