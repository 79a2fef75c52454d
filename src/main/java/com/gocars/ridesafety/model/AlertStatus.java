package com.gocars.ridesafety.model;

/**
 * Alert lifecycle. ACTIVE is the only non-terminal state.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    FALSE_ALARM;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
