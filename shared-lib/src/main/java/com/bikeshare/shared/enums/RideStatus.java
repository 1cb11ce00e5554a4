package com.bikeshare.shared.enums;

public enum RideStatus {
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
