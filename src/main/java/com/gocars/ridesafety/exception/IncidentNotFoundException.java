package com.gocars.ridesafety.exception;

public class IncidentNotFoundException extends RuntimeException {

    public IncidentNotFoundException(String incidentId) {
        super("Emergency incident not found: " + incidentId);
    }
}
