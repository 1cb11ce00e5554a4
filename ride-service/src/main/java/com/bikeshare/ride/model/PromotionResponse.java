package com.bikeshare.ride.model;

import com.bikeshare.ride.entity.PricingPlan;
import com.bikeshare.ride.entity.Promotion;
import com.bikeshare.ride.entity.Promotion.DiscountType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class PromotionResponse {
    private UUID id;
    private String name;
    private String description;
    private DiscountType discountType;
    private BigDecimal discountValue;
    private Instant startDate;
    private Instant endDate;
    private boolean active;
    private Integer usageLimit;
    private int usageCount;
    private List<UUID> planIds;
    private Instant createdAt;

    public static PromotionResponse from(Promotion promotion) {
        return PromotionResponse.builder()
                .id(promotion.getId())
                .name(promotion.getName())
                .description(promotion.getDescription())
                .discountType(promotion.getDiscountType())
                .discountValue(promotion.getDiscountValue())
                .startDate(promotion.getStartDate())
                .endDate(promotion.getEndDate())
                .active(promotion.isActive())
                .usageLimit(promotion.getUsageLimit())
                .usageCount(promotion.getUsageCount())
                .planIds(promotion.getPlans().stream().map(PricingPlan::getId).toList())
                .createdAt(promotion.getCreatedAt())
                .build();
    }
}
