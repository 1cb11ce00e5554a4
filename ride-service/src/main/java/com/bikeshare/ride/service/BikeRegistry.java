package com.bikeshare.ride.service;

import com.bikeshare.ride.model.BikeSnapshot;
import com.bikeshare.shared.enums.BikeStatus;

import java.util.Optional;
import java.util.UUID;

/**
 * Fleet state as seen by the ride lifecycle. Status changes are
 * compare-and-swap so two riders can never both take the same bike.
 */
public interface BikeRegistry {

    Optional<BikeSnapshot> getBike(UUID bikeId);

    /**
     * Moves the bike from {@code expected} to {@code target}.
     *
     * @return false when the bike was not in {@code expected}
     */
    boolean transition(UUID bikeId, BikeStatus expected, BikeStatus target);

    void updateLocation(UUID bikeId, double latitude, double longitude);
}
