package com.bikeshare.ride.model;

import com.bikeshare.ride.entity.PricingPlan.PlanType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AdjustedPlan {
    UUID planId;
    String name;
    PlanType planType;
    int minimumHours;
    BigDecimal hourlyRate;
    BigDecimal dailyRate;
    BigDecimal weeklyRate;
    BigDecimal monthlyRate;
    /** Hourly rate before rule multiplier and promotions. */
    BigDecimal originalHourlyRate;
    List<String> appliedPromotions;
}
