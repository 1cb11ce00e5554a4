package com.bikeshare.ride.service;

import com.bikeshare.ride.entity.PricingConfig;
import com.bikeshare.ride.entity.PricingPlan;
import com.bikeshare.ride.entity.PricingRule;
import com.bikeshare.ride.entity.Promotion;
import com.bikeshare.ride.model.AdjustedPlan;
import com.bikeshare.ride.model.PricingSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a pricing configuration into effective rates for one (date, hour) slot.
 *
 * Steps:
 *  1. Pick the highest-priority active rule whose day and hour window match.
 *  2. Multiply each active plan's four rates by the rule multiplier, rounded to whole units.
 *  3. Apply each plan's redeemable promotions in stored order (oldest first).
 *
 * Reads only what it is given; promotion usage is never changed here.
 */
@Slf4j
@Component
public class PricingResolver {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal HOURS_PER_DAY = BigDecimal.valueOf(24);
    private static final BigDecimal HOURS_PER_WEEK = BigDecimal.valueOf(24 * 7);
    private static final BigDecimal HOURS_PER_MONTH = BigDecimal.valueOf(24 * 30);

    public PricingSnapshot resolve(PricingConfig config, LocalDate targetDate, int targetHour, Instant now) {
        if (targetHour < 0 || targetHour > 23) {
            throw new IllegalArgumentException("Hour must be within 0-23, was " + targetHour);
        }

        Optional<PricingRule> rule = selectRule(config.getRules(), targetDate, targetHour);
        BigDecimal multiplier = rule.map(PricingRule::getMultiplier).orElse(BigDecimal.ONE);

        List<AdjustedPlan> plans = new ArrayList<>();
        Set<String> appliedPromotions = new LinkedHashSet<>();
        for (PricingPlan plan : config.getPlans()) {
            if (!plan.isActive()) {
                continue;
            }
            AdjustedPlan adjusted = adjustPlan(plan, multiplier, now);
            appliedPromotions.addAll(adjusted.getAppliedPromotions());
            plans.add(adjusted);
        }

        log.debug("Resolved pricing for {} {}:00 rule={} multiplier={} promotions={}",
                targetDate, targetHour, rule.map(PricingRule::getName).orElse(null), multiplier, appliedPromotions);

        return PricingSnapshot.builder()
                .configId(config.getId())
                .targetDate(targetDate)
                .targetHour(targetHour)
                .unlockFee(config.getUnlockFee())
                .multiplier(multiplier)
                .appliedRule(rule.map(PricingRule::getName).orElse(null))
                .plans(plans)
                .appliedPromotions(new ArrayList<>(appliedPromotions))
                .nextUpdate(targetDate.atTime(targetHour, 0).plusHours(1))
                .build();
    }

    Optional<PricingRule> selectRule(List<PricingRule> rules, LocalDate targetDate, int targetHour) {
        int dayOfWeek = dayOfWeek(targetDate);
        return rules.stream()
                .filter(PricingRule::isActive)
                .filter(r -> r.getDayOfWeek() == null || r.getDayOfWeek() == dayOfWeek)
                .filter(r -> hourMatches(r, targetHour))
                .sorted(Comparator.comparingInt(PricingRule::getPriority).reversed())
                .findFirst();
    }

    /**
     * Same-day windows are half-open {@code [start, end)}; a window with
     * start after end crosses midnight.
     */
    static boolean hourMatches(PricingRule rule, int hour) {
        Integer start = rule.getStartHour();
        Integer end = rule.getEndHour();
        if (start == null || end == null) {
            return true;
        }
        if (start <= end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }

    /** 0 = Sunday .. 6 = Saturday. */
    static int dayOfWeek(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    private AdjustedPlan adjustPlan(PricingPlan plan, BigDecimal multiplier, Instant now) {
        BigDecimal hourly = applyMultiplier(plan.getHourlyRate(), multiplier);
        BigDecimal daily = applyMultiplier(plan.getDailyRate(), multiplier);
        BigDecimal weekly = applyMultiplier(plan.getWeeklyRate(), multiplier);
        BigDecimal monthly = applyMultiplier(plan.getMonthlyRate(), multiplier);

        List<String> applied = new ArrayList<>();
        for (Promotion promotion : plan.getPromotions()) {
            if (!promotion.isValidAt(now) || !promotion.hasUsageLeft()) {
                continue;
            }
            BigDecimal value = promotion.getDiscountValue();
            switch (promotion.getDiscountType()) {
                case PERCENTAGE -> {
                    BigDecimal factor = BigDecimal.ONE.subtract(value.divide(HUNDRED));
                    hourly = applyMultiplier(hourly, factor);
                    daily = applyMultiplier(daily, factor);
                    weekly = applyMultiplier(weekly, factor);
                    monthly = applyMultiplier(monthly, factor);
                }
                case FIXED_AMOUNT -> {
                    hourly = subtractFloored(hourly, value);
                    daily = subtractFloored(daily, value.multiply(HOURS_PER_DAY));
                    weekly = subtractFloored(weekly, value.multiply(HOURS_PER_WEEK));
                    monthly = subtractFloored(monthly, value.multiply(HOURS_PER_MONTH));
                }
            }
            applied.add(promotion.getName());
        }

        return AdjustedPlan.builder()
                .planId(plan.getId())
                .name(plan.getName())
                .planType(plan.getPlanType())
                .minimumHours(plan.getMinimumHours())
                .hourlyRate(hourly)
                .dailyRate(daily)
                .weeklyRate(weekly)
                .monthlyRate(monthly)
                .originalHourlyRate(plan.getHourlyRate())
                .appliedPromotions(applied)
                .build();
    }

    private static BigDecimal applyMultiplier(BigDecimal rate, BigDecimal factor) {
        return rate.multiply(factor).setScale(0, RoundingMode.HALF_UP);
    }

    private static BigDecimal subtractFloored(BigDecimal rate, BigDecimal amount) {
        return rate.subtract(amount).max(BigDecimal.ZERO);
    }
}
