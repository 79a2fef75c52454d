package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of one emergency contact with its per-channel preferences.
 */
@Value
@Builder
public class EmergencyContact {

    String id;
    String name;
    String phoneNumber;
    String email;
    String relationship;
    boolean primary;
    boolean active;

    boolean smsEnabled;
    boolean callEnabled;
    boolean emailEnabled;
}
