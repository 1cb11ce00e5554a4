package com.bikeshare.ride.service;

import com.bikeshare.ride.model.BikeSnapshot;
import com.bikeshare.ride.repository.BikeRepository;
import com.bikeshare.shared.enums.BikeStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Bike registry over the co-located {@code bikes} table. Runs inside the
 * caller's transaction so bike changes commit or roll back with the ride.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaBikeRegistry implements BikeRegistry {

    private final BikeRepository bikeRepository;
    private final Clock clock;

    @Override
    public Optional<BikeSnapshot> getBike(UUID bikeId) {
        return bikeRepository.findById(bikeId)
                .map(b -> new BikeSnapshot(b.getId(), b.getStatus(), b.getBatteryLevel(), b.getLatitude(), b.getLongitude()));
    }

    @Override
    public boolean transition(UUID bikeId, BikeStatus expected, BikeStatus target) {
        boolean moved = bikeRepository.compareAndSetStatus(bikeId, expected, target, clock.instant()) == 1;
        if (moved) {
            log.debug("Bike {} {} -> {}", bikeId, expected, target);
        } else {
            log.debug("Bike {} not in {}, transition to {} refused", bikeId, expected, target);
        }
        return moved;
    }

    @Override
    public void updateLocation(UUID bikeId, double latitude, double longitude) {
        bikeRepository.updateLocation(bikeId, latitude, longitude, clock.instant());
    }
}
