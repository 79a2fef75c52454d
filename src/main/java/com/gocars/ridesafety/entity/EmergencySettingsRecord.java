package com.gocars.ridesafety.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "emergency_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencySettingsRecord {

    @Id
    @Column(name = "user_id")
    private String userId;

    private boolean autoCallEmergencyServices;
    private boolean shareLocationWithContacts;
    private boolean discreteMode;
    private boolean autoRecordAudio;
    private boolean autoTakePhotos;

    @Version
    private Long version;
}
