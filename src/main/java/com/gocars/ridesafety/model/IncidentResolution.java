package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class IncidentResolution {

    LocalDateTime resolvedAt;
    String resolvedBy;
    String resolution;
    boolean followUpRequired;
}
