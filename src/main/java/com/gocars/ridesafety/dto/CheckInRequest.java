package com.gocars.ridesafety.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckInRequest {

    @NotNull(message = "ok flag is required")
    private Boolean ok;

    @Size(max = 500, message = "Message must be at most 500 characters")
    private String message;

    @Valid
    private RoutePointRequest location;
}
