package com.gocars.ridesafety.model;

import lombok.*;

/**
 * Running driving-behavior counters for one ride. Speeds are in km/h.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriverBehaviorMetrics {

    private double averageSpeed;
    private double maxSpeed;

    /** Number of speed samples folded into averageSpeed */
    private long speedSamples;

    private int speedViolations;
    private int harshAccelerations;
    private int harshBraking;
    private int sharpTurns;

    @Builder.Default
    private double overallScore = 100.0;

    @Builder.Default
    private RiskLevel riskLevel = RiskLevel.LOW;

    public static DriverBehaviorMetrics initial() {
        return DriverBehaviorMetrics.builder().build();
    }
}
