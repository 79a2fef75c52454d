package com.gocars.ridesafety.model;

/**
 * Severity of a safety alert. Decides which response tier the alert engine runs.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
