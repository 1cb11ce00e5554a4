package com.bikeshare.ride.service;

import com.bikeshare.ride.config.BikeShareProperties;
import com.bikeshare.ride.entity.Ride;
import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.model.AdjustedPlan;
import com.bikeshare.ride.model.FareMode;
import com.bikeshare.ride.model.FareQuote;
import com.bikeshare.ride.model.PricingSnapshot;
import com.bikeshare.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

/**
 * Chooses the fare model for a ride and prices it.
 *
 * The configured {@code bikeshare.fare.mode} applies unless the
 * {@code dynamic_fare_pricing} feature flag is set for the tenant.
 * Pricing-plan fares use the rates in force at ride start.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FareQuoteService {

    private final FareCalculatorService fareCalculator;
    private final PricingService pricingService;
    private final FeatureFlagService featureFlagService;
    private final BikeShareProperties properties;

    public FareQuote quote(Ride ride, int durationMinutes, BigDecimal distanceKm) {
        FareMode mode = effectiveMode();
        if (mode == FareMode.FLAT) {
            BikeShareProperties.Fare fare = properties.getFare();
            return FareQuote.builder()
                    .durationMinutes(durationMinutes)
                    .distanceKm(distanceKm)
                    .cost(fareCalculator.flatFare(durationMinutes, fare.getPerMinuteRate(), fare.getUnlockFee()))
                    .mode(mode)
                    .build();
        }

        PricingSnapshot snapshot = pricingService.resolveAt(ride.getStartTime());
        AdjustedPlan plan = selectPlan(snapshot);
        BigDecimal cost = fareCalculator.planFare(durationMinutes, plan.getHourlyRate(), snapshot.getUnlockFee());
        log.debug("Ride {} priced on plan {} at {}/h (rule={}): {}",
                ride.getId(), plan.getName(), plan.getHourlyRate(), snapshot.getAppliedRule(), cost);
        return FareQuote.builder()
                .durationMinutes(durationMinutes)
                .distanceKm(distanceKm)
                .cost(cost)
                .mode(mode)
                .pricingRule(snapshot.getAppliedRule())
                .build();
    }

    public FareMode effectiveMode() {
        boolean configured = properties.getFare().getMode() == FareMode.PRICING_RESOLVER;
        return featureFlagService.isEnabled(FeatureFlagService.DYNAMIC_FARE_PRICING, configured)
                ? FareMode.PRICING_RESOLVER
                : FareMode.FLAT;
    }

    private AdjustedPlan selectPlan(PricingSnapshot snapshot) {
        String planName = properties.getFare().getPlanName();
        if (StringUtils.hasText(planName)) {
            return snapshot.plan(planName)
                    .orElseThrow(() -> new BikeShareException(ErrorCode.PRICING_PLAN_NOT_FOUND,
                            "No active pricing plan named " + planName));
        }
        return snapshot.getPlans().stream().findFirst()
                .orElseThrow(() -> new BikeShareException(ErrorCode.NO_PRICING_CONFIG,
                        "Active pricing configuration has no active plans"));
    }
}
