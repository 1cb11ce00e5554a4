package com.bikeshare.ride.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Aggregates over a rider's completed rides.
 */
@Data
@Builder
public class RideStats {
    private String riderId;
    private long completedRides;
    private BigDecimal totalDistanceKm;
    private BigDecimal averageDistanceKm;
    private long totalDurationMinutes;
    private BigDecimal averageDurationMinutes;
    private BigDecimal totalCost;
}
