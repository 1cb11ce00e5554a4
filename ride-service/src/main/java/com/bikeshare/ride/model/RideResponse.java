package com.bikeshare.ride.model;

import com.bikeshare.ride.entity.Ride;
import com.bikeshare.shared.enums.RideStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class RideResponse {
    private UUID rideId;
    private String riderId;
    private UUID bikeId;
    private RideStatus status;
    private Instant startTime;
    private Instant endTime;
    private double startLat;
    private double startLng;
    private Double endLat;
    private Double endLng;
    private BigDecimal distanceKm;
    private Integer durationMinutes;
    private BigDecimal cost;
    private String pricingRule;

    public static RideResponse from(Ride ride) {
        return RideResponse.builder()
                .rideId(ride.getId())
                .riderId(ride.getRiderId())
                .bikeId(ride.getBikeId())
                .status(ride.getStatus())
                .startTime(ride.getStartTime())
                .endTime(ride.getEndTime())
                .startLat(ride.getStartLat())
                .startLng(ride.getStartLng())
                .endLat(ride.getEndLat())
                .endLng(ride.getEndLng())
                .distanceKm(ride.getDistanceKm())
                .durationMinutes(ride.getDurationMinutes())
                .cost(ride.getCost())
                .pricingRule(ride.getPricingRule())
                .build();
    }
}
