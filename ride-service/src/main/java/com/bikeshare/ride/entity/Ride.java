package com.bikeshare.ride.entity;

import com.bikeshare.shared.enums.RideStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "rides",
        indexes = {
                @Index(name = "idx_ride_rider_status", columnList = "rider_id, status"),
                @Index(name = "idx_ride_bike", columnList = "bike_id"),
                @Index(name = "idx_ride_start_time", columnList = "start_time")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Ride {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(name = "rider_id", nullable = false)
    private String riderId;

    @Column(name = "bike_id", nullable = false)
    private UUID bikeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RideStatus status;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "start_lat", nullable = false)
    private double startLat;

    @Column(name = "start_lng", nullable = false)
    private double startLng;

    @Column(name = "end_lat")
    private Double endLat;

    @Column(name = "end_lng")
    private Double endLng;

    @Column(name = "distance_km", precision = 10, scale = 2)
    private BigDecimal distanceKm;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "cost", precision = 12, scale = 2)
    private BigDecimal cost;

    /** Pricing rule that governed the fare, when the resolver priced it. */
    @Column(name = "pricing_rule")
    private String pricingRule;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isActive() {
        return status == RideStatus.IN_PROGRESS;
    }

    public void complete(Instant endedAt, double lat, double lng, BigDecimal distance,
                         int duration, BigDecimal fare, String rule) {
        this.status = RideStatus.COMPLETED;
        this.endTime = endedAt;
        this.endLat = lat;
        this.endLng = lng;
        this.distanceKm = distance;
        this.durationMinutes = duration;
        this.cost = fare;
        this.pricingRule = rule;
    }

    public void cancel(Instant cancelledAt) {
        this.status = RideStatus.CANCELLED;
        this.endTime = cancelledAt;
    }
}
