package com.gocars.ridesafety.model;

import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafetyAlert {

    private String id;
    private AlertType type;
    private AlertSeverity severity;
    private LocalDateTime triggeredAt;

    /** Latest fix at trigger time, null when the ride has no fix yet */
    private RoutePoint location;

    private String description;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    @Builder.Default
    private AlertStatus status = AlertStatus.ACTIVE;

    private String acknowledgedBy;
    private LocalDateTime acknowledgedAt;
    private LocalDateTime resolvedAt;

    @Builder.Default
    private List<AlertAction> actions = new ArrayList<>();

    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }
}
