package com.bikeshare.ride.model;

import com.bikeshare.ride.entity.PricingPlan.PlanType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Replacement content for the active pricing configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingConfigRequest {

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal unlockFee;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal baseHourlyRate;

    @Valid
    @Builder.Default
    private List<Plan> plans = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<Rule> rules = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Plan {
        @NotBlank
        private String name;
        @Builder.Default
        private PlanType planType = PlanType.HOURLY;
        @NotNull @DecimalMin("0.00")
        private BigDecimal hourlyRate;
        @NotNull @DecimalMin("0.00")
        private BigDecimal dailyRate;
        @NotNull @DecimalMin("0.00")
        private BigDecimal weeklyRate;
        @NotNull @DecimalMin("0.00")
        private BigDecimal monthlyRate;
        @Builder.Default
        private int minimumHours = 1;
        @Builder.Default
        private boolean active = true;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Rule {
        @NotBlank
        private String name;
        /** 0 = Sunday .. 6 = Saturday; null for every day. */
        @Min(0) @Max(6)
        private Integer dayOfWeek;
        /**
         * Window start, inclusive. With {@code endHour} it covers [start, end);
         * start after end wraps past midnight, 24 closes at end of day, and
         * equal hours are rejected. Null on either side means all day.
         */
        @Min(0) @Max(23)
        private Integer startHour;
        @Min(0) @Max(24)
        private Integer endHour;
        @NotNull @DecimalMin("0.0")
        private BigDecimal multiplier;
        @Builder.Default
        private boolean active = true;
        private int priority;
    }
}
