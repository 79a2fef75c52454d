package com.gocars.ridesafety.model;

import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafetyCheckIn {

    private String id;
    private LocalDateTime scheduledAt;

    /** Response deadline; null for manual check-ins */
    private LocalDateTime deadline;

    private LocalDateTime completedAt;
    private CheckInType type;

    @Builder.Default
    private CheckInStatus status = CheckInStatus.PENDING;

    private CheckInResponse response;
    private boolean followUpRequired;

    public boolean isPending() {
        return status == CheckInStatus.PENDING;
    }
}
