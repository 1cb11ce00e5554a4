package com.bikeshare.ride.model;

import com.bikeshare.shared.enums.BikeStatus;

import java.util.UUID;

/**
 * Read-only view of a bike as the ride lifecycle sees it.
 */
public record BikeSnapshot(UUID id, BikeStatus status, Integer batteryLevel, Double latitude, Double longitude) {

    public boolean isAvailable() {
        return status == BikeStatus.AVAILABLE;
    }
}
