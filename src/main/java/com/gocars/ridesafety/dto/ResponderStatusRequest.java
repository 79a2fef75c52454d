package com.gocars.ridesafety.dto;

import com.gocars.ridesafety.model.ResponderStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ResponderStatusRequest {

    @NotNull(message = "Status is required")
    private ResponderStatus status;
}
