package com.gocars.ridesafety.dto;

import com.gocars.ridesafety.model.IncidentType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * SOS or other emergency raised from the rider app.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateIncidentRequest {

    @NotBlank(message = "User ID is required")
    private String userId;

    private String rideId;

    @NotNull(message = "Incident type is required")
    private IncidentType type;

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double longitude;

    private Double accuracy;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    /** Overrides the rider's discrete-mode setting when present */
    private Boolean discreteMode;

    private boolean requestEmergencyServices;
}
