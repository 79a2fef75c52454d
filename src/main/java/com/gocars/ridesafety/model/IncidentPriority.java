package com.gocars.ridesafety.model;

public enum IncidentPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(IncidentPriority other) {
        return compareTo(other) >= 0;
    }
}
