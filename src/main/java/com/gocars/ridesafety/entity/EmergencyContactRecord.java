package com.gocars.ridesafety.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One emergency contact of a rider with the channels it accepts.
 */
@Entity
@Table(
    name = "emergency_contacts",
    indexes = @Index(name = "idx_emergency_contact_user_id", columnList = "user_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyContactRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String name;

    private String phoneNumber;
    private String email;
    private String relationship;

    // "primary" is a reserved word in H2
    @Column(name = "is_primary")
    private boolean primary;

    private boolean active;
    private boolean smsEnabled;
    private boolean callEnabled;
    private boolean emailEnabled;
}
