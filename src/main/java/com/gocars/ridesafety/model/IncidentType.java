package com.gocars.ridesafety.model;

/**
 * Kind of emergency. Each type maps to exactly one {@link IncidentPriority}, fixed when the
 * incident is created.
 */
public enum IncidentType {
    SOS,
    PANIC,
    MEDICAL,
    ACCIDENT,
    HARASSMENT,
    VEHICLE_ISSUE,
    OTHER;

    public IncidentPriority priority() {
        switch (this) {
            case SOS:
            case MEDICAL:
            case ACCIDENT:
                return IncidentPriority.CRITICAL;
            case PANIC:
            case HARASSMENT:
                return IncidentPriority.HIGH;
            case VEHICLE_ISSUE:
                return IncidentPriority.MEDIUM;
            default:
                return IncidentPriority.LOW;
        }
    }
}
