package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class TimelineEvent {

    String id;
    LocalDateTime timestamp;
    TimelineEventType type;
    String description;
    String actor;
}
