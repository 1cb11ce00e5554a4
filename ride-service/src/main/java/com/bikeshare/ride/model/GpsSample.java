package com.bikeshare.ride.model;

import java.time.Instant;

public record GpsSample(double latitude, double longitude, Instant timestamp) {
}
