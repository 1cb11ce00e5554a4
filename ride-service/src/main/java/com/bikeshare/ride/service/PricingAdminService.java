package com.bikeshare.ride.service;

import com.bikeshare.ride.entity.PricingConfig;
import com.bikeshare.ride.entity.PricingPlan;
import com.bikeshare.ride.entity.PricingRule;
import com.bikeshare.ride.entity.Promotion;
import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.model.PricingConfigRequest;
import com.bikeshare.ride.model.PricingConfigResponse;
import com.bikeshare.ride.model.PromotionRequest;
import com.bikeshare.ride.model.PromotionResponse;
import com.bikeshare.ride.repository.PricingConfigRepository;
import com.bikeshare.ride.repository.PricingPlanRepository;
import com.bikeshare.ride.repository.PromotionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Maintains the single active pricing configuration and its promotions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingAdminService {

    private static final BigDecimal MAX_PERCENTAGE = BigDecimal.valueOf(100);

    private final PricingConfigRepository configRepository;
    private final PricingPlanRepository planRepository;
    private final PromotionRepository promotionRepository;

    /**
     * Replaces the plans and rules of the active configuration, creating it
     * when there is none. Promotions survive but lose their plan links, since
     * the plans they pointed at are gone.
     */
    @Transactional
    public PricingConfigResponse upsertConfig(PricingConfigRequest req) {
        req.getRules().forEach(PricingAdminService::requireHourWindow);

        PricingConfig config = configRepository.findFirstByActiveTrueOrderByCreatedAtDesc()
                .orElseGet(() -> PricingConfig.builder().active(true).build());

        if (config.getId() != null) {
            // Join rows first, then the orphaned plans and rules.
            config.getPromotions().forEach(p -> p.getPlans().clear());
            configRepository.flush();
            config.getPlans().clear();
            config.getRules().clear();
            configRepository.flush();
        }

        config.setUnlockFee(req.getUnlockFee());
        config.setBaseHourlyRate(req.getBaseHourlyRate());

        int order = 0;
        for (PricingConfigRequest.Plan p : req.getPlans()) {
            config.addPlan(PricingPlan.builder()
                    .name(p.getName())
                    .planType(p.getPlanType())
                    .hourlyRate(p.getHourlyRate())
                    .dailyRate(p.getDailyRate())
                    .weeklyRate(p.getWeeklyRate())
                    .monthlyRate(p.getMonthlyRate())
                    .minimumHours(p.getMinimumHours())
                    .active(p.isActive())
                    .displayOrder(order++)
                    .build());
        }
        for (PricingConfigRequest.Rule r : req.getRules()) {
            config.addRule(PricingRule.builder()
                    .name(r.getName())
                    .dayOfWeek(r.getDayOfWeek())
                    .startHour(r.getStartHour())
                    .endHour(r.getEndHour())
                    .multiplier(r.getMultiplier())
                    .active(r.isActive())
                    .priority(r.getPriority())
                    .build());
        }

        if (config.getId() == null) {
            configRepository.save(config);
        }
        configRepository.flush();
        log.info("Pricing config {} updated: {} plans, {} rules, unlockFee={}",
                config.getId(), config.getPlans().size(), config.getRules().size(), config.getUnlockFee());
        return PricingConfigResponse.from(config);
    }

    // An equal start and end hour would match no hour at all.
    private static void requireHourWindow(PricingConfigRequest.Rule rule) {
        if (rule.getStartHour() != null && rule.getStartHour().equals(rule.getEndHour())) {
            throw new BikeShareException(ErrorCode.INVALID_TIME_RANGE,
                    "Rule " + rule.getName() + " has an empty hour window " + rule.getStartHour() + "-" + rule.getEndHour());
        }
    }

    @Transactional
    public PromotionResponse createPromotion(PromotionRequest req) {
        if (!req.getEndDate().isAfter(req.getStartDate())) {
            throw new BikeShareException(ErrorCode.INVALID_TIME_RANGE, "Promotion must end after it starts");
        }
        if (req.getDiscountType() == Promotion.DiscountType.PERCENTAGE
                && req.getDiscountValue().compareTo(MAX_PERCENTAGE) > 0) {
            throw new BikeShareException(ErrorCode.INVALID_AMOUNT, "Percentage discount cannot exceed 100");
        }

        PricingConfig config = configRepository.findFirstByActiveTrueOrderByCreatedAtDesc()
                .orElseThrow(() -> new BikeShareException(ErrorCode.NO_PRICING_CONFIG, "No active pricing configuration"));

        Set<UUID> planIds = new LinkedHashSet<>(req.getPlanIds());
        List<PricingPlan> plans = planRepository.findAllById(planIds);
        boolean allOwned = plans.stream().allMatch(p -> p.getPricingConfig().getId().equals(config.getId()));
        if (plans.size() != planIds.size() || !allOwned) {
            throw new BikeShareException(ErrorCode.PRICING_PLAN_NOT_FOUND,
                    "Unknown plan ids for the active configuration: " + planIds);
        }

        Promotion promotion = Promotion.builder()
                .name(req.getName())
                .description(req.getDescription())
                .discountType(req.getDiscountType())
                .discountValue(req.getDiscountValue())
                .startDate(req.getStartDate())
                .endDate(req.getEndDate())
                .active(req.isActive())
                .usageLimit(req.getUsageLimit())
                .usageCount(0)
                .build();
        promotion.getPlans().addAll(plans);
        config.addPromotion(promotion);

        Promotion saved = promotionRepository.save(promotion);
        log.info("Promotion {} '{}' created: {} {} on {} plans",
                saved.getId(), saved.getName(), saved.getDiscountType(), saved.getDiscountValue(), plans.size());
        return PromotionResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<PromotionResponse> listPromotions() {
        return promotionRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(PromotionResponse::from)
                .toList();
    }
}
