package com.gocars.ridesafety.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Closing record for an incident, for both resolution and false alarm.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolveIncidentRequest {

    @NotBlank(message = "Resolver ID is required")
    private String resolvedBy;

    @NotBlank(message = "Resolution is required")
    private String resolution;

    private boolean followUpRequired;
}
