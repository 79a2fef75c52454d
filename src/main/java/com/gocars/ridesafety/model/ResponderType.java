package com.gocars.ridesafety.model;

public enum ResponderType {
    EMERGENCY_SERVICES,
    SECURITY_TEAM,
    SUPPORT_AGENT,
    DRIVER
}
