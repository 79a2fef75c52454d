package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Read-only snapshot of a rider's emergency settings and contacts.
 */
@Value
@Builder(toBuilder = true)
public class EmergencySettings {

    String userId;
    long version;

    @Singular
    List<EmergencyContact> emergencyContacts;

    boolean autoCallEmergencyServices;
    boolean shareLocationWithContacts;
    boolean discreteMode;
    boolean autoRecordAudio;
    boolean autoTakePhotos;

    public List<EmergencyContact> activeContacts() {
        return emergencyContacts.stream().filter(EmergencyContact::isActive).toList();
    }

    public static EmergencySettings defaults(String userId) {
        return EmergencySettings.builder()
                .userId(userId)
                .version(0)
                .autoCallEmergencyServices(false)
                .shareLocationWithContacts(true)
                .discreteMode(false)
                .autoRecordAudio(false)
                .autoTakePhotos(false)
                .build();
    }
}
