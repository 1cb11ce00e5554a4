package com.bikeshare.ride.entity;

import com.bikeshare.shared.enums.BikeStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Fleet row. Status changes go through {@code BikeRepository}'s conditional
 * updates only, never through dirty checking of this entity.
 */
@Entity
@Table(name = "bikes",
        indexes = {
                @Index(name = "idx_bike_code", columnList = "code", unique = true),
                @Index(name = "idx_bike_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Bike {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String code;

    @Column(name = "model")
    private String model;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BikeStatus status;

    @Column(name = "battery_level")
    private int batteryLevel;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
