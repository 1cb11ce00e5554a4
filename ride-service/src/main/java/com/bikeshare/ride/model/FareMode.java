package com.bikeshare.ride.model;

/**
 * How a completed ride is priced.
 */
public enum FareMode {
    /** Per-minute rate plus unlock fee from configuration. */
    FLAT,
    /** Hourly rate of the active pricing plan, adjusted by rules and promotions at ride start. */
    PRICING_RESOLVER
}
