package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.AlertSeverity;
import com.gocars.ridesafety.model.AlertType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A detector's request to raise an alert. The alert engine turns it into a {@code SafetyAlert}
 * and runs the response actions.
 */
@Value
@Builder
public class SafetySignal {

    AlertType type;
    AlertSeverity severity;
    String description;
    @Singular("datum")
    Map<String, Object> data;

    public static SafetySignal of(AlertType type, AlertSeverity severity, String description) {
        return SafetySignal.builder().type(type).severity(severity).description(description).build();
    }
}
