package com.gocars.ridesafety.entity;

import com.gocars.ridesafety.model.AlertSensitivity;
import jakarta.persistence.*;
import lombok.*;

/**
 * Per-rider safety settings, written by the settings service and only read here.
 */
@Entity
@Table(name = "safety_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafetySettingsRecord {

    @Id
    @Column(name = "user_id")
    private String userId;

    private boolean rideMonitoringEnabled;

    /** Metres */
    private double routeDeviationThreshold;

    /** Percent */
    private double speedViolationTolerance;

    private int checkInIntervalMinutes;

    private boolean automaticCheckInsEnabled;
    private boolean emergencyContactsOnAlert;
    private boolean shareLocationDuringRide;
    private boolean driverBehaviorMonitoring;

    @Enumerated(EnumType.STRING)
    private AlertSensitivity alertSensitivity;

    @Version
    private Long version;
}
