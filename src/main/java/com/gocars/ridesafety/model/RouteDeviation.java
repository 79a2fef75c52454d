package com.gocars.ridesafety.model;

import lombok.*;

import java.time.LocalDateTime;

/**
 * One off-route episode. Opened by the first off-route fix, extended by the following ones and
 * resolved by the first fix back within the threshold.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RouteDeviation {

    private String id;

    private LocalDateTime detectedAt;

    private DeviationSeverity severity;

    /** Largest distance from the planned route seen during the episode, in metres */
    private double distanceFromRoute;

    /** Seconds between detection and the latest off-route fix */
    private long durationSeconds;

    /** Latest off-route fix */
    private RoutePoint location;

    private boolean resolved;

    private LocalDateTime resolvedAt;

    /** Set once the ROUTE_DEVIATION alert for this episode has been raised */
    private boolean alertTriggered;
}
