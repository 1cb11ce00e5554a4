package com.bikeshare.ride.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Fare computed for a ride before settlement.
 */
@Value
@Builder
public class FareQuote {
    int durationMinutes;
    BigDecimal distanceKm;
    BigDecimal cost;
    FareMode mode;
    /** Pricing rule that set the multiplier; null for flat fares or when no rule matched. */
    String pricingRule;
}
