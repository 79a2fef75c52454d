package com.gocars.ridesafety.model;

/**
 * Risk band derived from the driver behavior score.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
