package com.bikeshare.ride.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Effective rates for one (date, hour) slot.
 */
@Value
@Builder
public class PricingSnapshot {
    UUID configId;
    LocalDate targetDate;
    int targetHour;
    BigDecimal unlockFee;
    BigDecimal multiplier;
    /** Name of the matched rule, null when none matched. */
    String appliedRule;
    List<AdjustedPlan> plans;
    List<String> appliedPromotions;
    /** Start of the hour after the target slot. */
    LocalDateTime nextUpdate;

    public Optional<AdjustedPlan> plan(String name) {
        return plans.stream().filter(p -> p.getName().equals(name)).findFirst();
    }
}
