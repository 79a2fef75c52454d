package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.RoutePoint;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StartMonitoringCommand {

    String rideId;
    String userId;
    String driverId;

    /** Ordered planned path; empty disables route-deviation checks */
    @Singular("plannedPoint")
    List<RoutePoint> plannedRoute;
}
