package com.gocars.ridesafety.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * Position report from a rider's device.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationReportRequest {

    @NotBlank(message = "User ID is required")
    private String userId;

    @Valid
    @NotNull(message = "Position is required")
    private RoutePointRequest position;
}
