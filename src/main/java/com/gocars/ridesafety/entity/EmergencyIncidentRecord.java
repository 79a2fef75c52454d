package com.gocars.ridesafety.entity;

import com.gocars.ridesafety.model.IncidentPriority;
import com.gocars.ridesafety.model.IncidentStatus;
import com.gocars.ridesafety.model.IncidentType;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Stored emergency incident. Rows are only ever inserted or updated, never deleted.
 */
@Entity
@Table(
    name = "emergency_incidents",
    indexes = {
        @Index(name = "idx_emergency_incident_user_id", columnList = "user_id"),
        @Index(name = "idx_emergency_incident_status",  columnList = "status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyIncidentRecord {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "ride_id")
    private String rideId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentPriority priority;

    @Column(name = "snapshot_version", nullable = false)
    private long version;

    @Lob
    @Column(nullable = false)
    private String document;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = this.updatedAt;
        }
    }
}
