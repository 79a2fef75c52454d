package com.gocars.ridesafety.entity;

import com.gocars.ridesafety.model.SessionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Stored monitoring session: indexed columns for dashboard queries plus the full JSON document.
 *
 * {@code version} is the session's own write sequence, not a JPA optimistic-lock column: the
 * record store compares it before every write and drops snapshots that are not newer.
 */
@Entity
@Table(
    name = "monitoring_sessions",
    indexes = {
        @Index(name = "idx_monitoring_session_ride_id", columnList = "ride_id"),
        @Index(name = "idx_monitoring_session_user_id", columnList = "user_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonitoringSessionRecord {

    @Id
    private String id;

    @Column(name = "ride_id", nullable = false)
    private String rideId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status;

    private double riskScore;

    private boolean active;

    @Column(name = "snapshot_version", nullable = false)
    private long version;

    @Lob
    @Column(nullable = false)
    private String document;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
