package com.gocars.ridesafety.dto;

import com.gocars.ridesafety.model.RoutePoint;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One position as sent by clients: a planned-route point or a live fix.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoutePointRequest {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double longitude;

    /** Device time; the server time is used when absent */
    private LocalDateTime timestamp;

    @PositiveOrZero(message = "Speed cannot be negative")
    private Double speed; // m/s

    private Double heading;

    @PositiveOrZero(message = "Accuracy cannot be negative")
    private Double accuracy;

    public RoutePoint toRoutePoint(LocalDateTime fallbackTimestamp) {
        return RoutePoint.builder()
                .latitude(latitude)
                .longitude(longitude)
                .timestamp(timestamp != null ? timestamp : fallbackTimestamp)
                .speed(speed)
                .heading(heading)
                .accuracy(accuracy)
                .build();
    }
}
