package com.gocars.ridesafety.model;

import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyResponder {

    private String id;
    private ResponderType type;
    private String name;
    private String phoneNumber;

    @Builder.Default
    private ResponderStatus status = ResponderStatus.NOTIFIED;

    private LocalDateTime estimatedArrival;
}
