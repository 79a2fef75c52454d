package com.gocars.ridesafety.model;

public enum IncidentStatus {
    ACTIVE,
    RESPONDING,
    RESOLVED,
    FALSE_ALARM;

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_ALARM;
    }
}
