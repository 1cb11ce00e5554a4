package com.bikeshare.shared.enums;

public enum BikeStatus {
    AVAILABLE,
    IN_USE,
    MAINTENANCE,
    UNAVAILABLE
}
