package com.gocars.ridesafety.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StartMonitoringRequest {

    @NotBlank(message = "Ride ID is required")
    private String rideId;

    @NotBlank(message = "User ID is required")
    private String userId;

    private String driverId;

    @Builder.Default
    private List<@Valid RoutePointRequest> plannedRoute = new ArrayList<>();
}
