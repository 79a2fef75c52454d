package com.gocars.ridesafety.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AlertActionRequest {

    @NotBlank(message = "Actor is required")
    private String actor;
}
