package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A single timestamped position sample (a "fix"). Immutable once recorded.
 *
 * speed is in m/s as reported by the device, heading in degrees clockwise from north,
 * accuracy in metres. All three are optional.
 */
@Value
@Builder
public class RoutePoint {

    double latitude;
    double longitude;
    LocalDateTime timestamp;

    Double speed;
    Double heading;
    Double accuracy;

    public static RoutePoint of(double latitude, double longitude, LocalDateTime timestamp) {
        return RoutePoint.builder()
                .latitude(latitude)
                .longitude(longitude)
                .timestamp(timestamp)
                .build();
    }
}
