package com.gocars.ridesafety.model;

import lombok.*;

import java.time.LocalDateTime;

/**
 * One response step taken for an alert. A failed step is recorded with success=false and does not
 * prevent the other steps.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertAction {

    private String id;
    private AlertActionType type;
    private LocalDateTime timestamp;

    /** "system" for automatic actions */
    private String actor;

    private String details;
    private boolean success;
}
