package com.bikeshare.ride.model;

import com.bikeshare.ride.entity.PricingConfig;
import com.bikeshare.ride.entity.PricingPlan;
import com.bikeshare.ride.entity.PricingPlan.PlanType;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record PricingConfigResponse(UUID id, BigDecimal unlockFee, BigDecimal baseHourlyRate,
                                    List<PlanView> plans, List<String> rules) {

    public record PlanView(UUID id, String name, PlanType planType, BigDecimal hourlyRate, boolean active) {
        static PlanView from(PricingPlan plan) {
            return new PlanView(plan.getId(), plan.getName(), plan.getPlanType(), plan.getHourlyRate(), plan.isActive());
        }
    }

    public static PricingConfigResponse from(PricingConfig config) {
        return new PricingConfigResponse(
                config.getId(),
                config.getUnlockFee(),
                config.getBaseHourlyRate(),
                config.getPlans().stream().map(PlanView::from).toList(),
                config.getRules().stream().map(r -> r.getName()).toList());
    }
}
