package com.gocars.ridesafety.model;

import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A user-visible emergency. Never deleted; RESOLVED and FALSE_ALARM are terminal and carry a
 * {@link IncidentResolution}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyIncident {

    private String id;
    private String userId;
    private String rideId;
    private IncidentType type;

    @Builder.Default
    private IncidentStatus status = IncidentStatus.ACTIVE;

    /** Fixed at creation from {@link IncidentType#priority()} */
    private IncidentPriority priority;

    private IncidentLocation location;
    private LocalDateTime createdAt;
    private String description;

    /** Ids of the contacts that were active when the incident was created */
    @Builder.Default
    private List<String> emergencyContacts = new ArrayList<>();

    @Builder.Default
    private List<EmergencyResponder> responders = new ArrayList<>();

    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    private IncidentResolution resolution;

    private long version;

    public Optional<EmergencyResponder> findResponder(String responderId) {
        return responders.stream().filter(r -> r.getId().equals(responderId)).findFirst();
    }

    public boolean hasResponder(ResponderType responderType) {
        return responders.stream().anyMatch(r -> r.getType() == responderType);
    }

    public long nextVersion() {
        return ++version;
    }
}
