package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of a rider's safety settings.
 */
@Value
@Builder(toBuilder = true)
public class SafetySettings {

    String userId;

    /** Version of the stored settings, 0 for defaults */
    long version;

    boolean rideMonitoringEnabled;

    /** Metres */
    double routeDeviationThreshold;

    /** Percent above the posted limit */
    double speedViolationTolerance;

    /** Minutes */
    int checkInIntervalMinutes;

    boolean automaticCheckInsEnabled;
    boolean emergencyContactsOnAlert;
    boolean shareLocationDuringRide;
    boolean driverBehaviorMonitoring;
    AlertSensitivity alertSensitivity;

    public static SafetySettings defaults(String userId) {
        return SafetySettings.builder()
                .userId(userId)
                .version(0)
                .rideMonitoringEnabled(true)
                .routeDeviationThreshold(500)
                .speedViolationTolerance(20)
                .checkInIntervalMinutes(10)
                .automaticCheckInsEnabled(true)
                .emergencyContactsOnAlert(true)
                .shareLocationDuringRide(true)
                .driverBehaviorMonitoring(true)
                .alertSensitivity(AlertSensitivity.MEDIUM)
                .build();
    }
}
