package com.gocars.ridesafety.config;

import com.gocars.ridesafety.model.AlertSeverity;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the safety core, bound from {@code ride-safety.*}.
 *
 * Per-rider values (deviation threshold, speed tolerance, check-in interval) live in the
 * rider's settings instead; everything here applies fleet-wide.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ride-safety")
public class RideSafetyProperties {

    private Monitoring monitoring = new Monitoring();
    private Location location = new Location();
    private Deviation deviation = new Deviation();
    private Behavior behavior = new Behavior();
    private Stop stop = new Stop();
    private CheckIn checkIn = new CheckIn();
    private Risk risk = new Risk();
    private Incident incident = new Incident();

    @Getter
    @Setter
    public static class Monitoring {
        /** Location polling interval per session */
        private Duration pollInterval = Duration.ofSeconds(15);
        /** How long one location sample may take before the cycle is skipped */
        private Duration sampleTimeout = Duration.ofSeconds(10);
        /** Consecutive empty polling cycles before a COMMUNICATION_LOSS alert */
        private int communicationLossCycles = 4;
    }

    @Getter
    @Setter
    public static class Location {
        /** Oldest device report the location buffer still hands out */
        private Duration maxAge = Duration.ofSeconds(20);
    }

    public enum MatchMode { VERTEX, SEGMENT }

    @Getter
    @Setter
    public static class Deviation {
        /** A deviation beyond threshold × multiplier is MAJOR */
        private double majorMultiplier = 2.0;
        private MatchMode matchMode = MatchMode.SEGMENT;
        private AlertSeverity alertSeverity = AlertSeverity.MEDIUM;
    }

    @Getter
    @Setter
    public static class Behavior {
        /** Posted limit used when the road limit is unknown */
        private double speedLimitKmh = 50;
        /** m/s² */
        private double harshAccelerationThreshold = 3.0;
        private double sharpTurnDegrees = 45;
        private double sharpTurnMinSpeedKmh = 20;

        private double speedViolationPenalty = 5;
        private double harshAccelerationPenalty = 2;
        private double harshBrakingPenalty = 2;
        private double sharpTurnPenalty = 1;

        /** Lower bounds of the LOW / MEDIUM / HIGH risk bands; below is CRITICAL */
        private double lowRiskScore = 90;
        private double mediumRiskScore = 70;
        private double highRiskScore = 50;

        private AlertSeverity speedViolationSeverity = AlertSeverity.MEDIUM;
        private AlertSeverity harshDrivingSeverity = AlertSeverity.LOW;
    }

    @Getter
    @Setter
    public static class Stop {
        private double speedThresholdKmh = 3;
        private Duration maxDuration = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class CheckIn {
        /** Time a rider has to answer a prompted check-in */
        private Duration responseTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Risk {
        private double openDeviationWeight = 10;
        private double majorDeviationWeight = 20;
        /** Applied to (100 - behavior score) */
        private double behaviorWeight = 0.5;
        private double activeAlertWeight = 5;
        private double highAlertWeight = 15;
        private double criticalAlertWeight = 30;
        private double missedCheckInWeight = 25;

        /** Scores strictly above these bounds switch the session status */
        private double alertThreshold = 50;
        private double emergencyThreshold = 80;
    }

    @Getter
    @Setter
    public static class Incident {
        private Duration trackingInterval = Duration.ofSeconds(10);
        private Duration audioRecordingDuration = Duration.ofMinutes(5);
        private String securityTeamName = "GoCars Security Team";
        private String securityTeamPhone = "+1-800-GOCARS-911";
        private Duration securityTeamEta = Duration.ofMinutes(15);
        private String supportAgentName = "Emergency Support Agent";
        private String emergencyServicesNumber = "911";
        private Duration emergencyServicesEta = Duration.ofMinutes(8);
        /** How long a closed incident stays readable in memory; the durable record outlives it */
        private Duration closedRetention = Duration.ofHours(1);
        private long closedMaxSize = 1000;
    }
}
