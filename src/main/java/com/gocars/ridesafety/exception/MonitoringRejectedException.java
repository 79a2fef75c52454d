package com.gocars.ridesafety.exception;

/**
 * Monitoring cannot start: the ride already has an active session or the rider turned ride
 * monitoring off.
 */
public class MonitoringRejectedException extends RuntimeException {

    public MonitoringRejectedException(String message) {
        super(message);
    }
}
