package com.gocars.ridesafety.model;

/**
 * Coarse status of a monitored ride, derived from the risk score while the ride is active.
 */
public enum SessionStatus {

    MONITORING,

    /** Risk score above the alert bound */
    ALERT_TRIGGERED,

    /** Risk score above the emergency bound */
    EMERGENCY,

    /** Monitoring stopped explicitly - terminal */
    COMPLETED
}
