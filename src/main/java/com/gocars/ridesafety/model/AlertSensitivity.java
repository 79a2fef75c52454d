package com.gocars.ridesafety.model;

public enum AlertSensitivity {
    LOW,
    MEDIUM,
    HIGH
}
