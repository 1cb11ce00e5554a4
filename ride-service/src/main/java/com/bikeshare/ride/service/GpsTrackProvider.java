package com.bikeshare.ride.service;

import com.bikeshare.ride.model.GpsSample;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface GpsTrackProvider {

    /**
     * Location samples recorded for the bike in {@code [from, to]}, oldest first.
     * Empty when no trace is available.
     */
    List<GpsSample> getTrace(UUID bikeId, Instant from, Instant to);
}
