package com.bikeshare.ride.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pricing aggregate. Plans, rules and promotions are owned by a config and
 * never outlive it. At most one config is active.
 */
@Entity
@Table(name = "pricing_configs",
        indexes = @Index(name = "idx_pricing_config_active", columnList = "active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PricingConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "unlock_fee", nullable = false, precision = 12, scale = 2)
    private BigDecimal unlockFee;

    @Column(name = "base_hourly_rate", nullable = false, precision = 12, scale = 2)
    private BigDecimal baseHourlyRate;

    @Column(name = "active", nullable = false)
    private boolean active;

    @OneToMany(mappedBy = "pricingConfig", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("displayOrder ASC")
    @Builder.Default
    @ToString.Exclude
    private List<PricingPlan> plans = new ArrayList<>();

    @OneToMany(mappedBy = "pricingConfig", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("priority DESC")
    @Builder.Default
    @ToString.Exclude
    private List<PricingRule> rules = new ArrayList<>();

    @OneToMany(mappedBy = "pricingConfig", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    @Builder.Default
    @ToString.Exclude
    private List<Promotion> promotions = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public void addPlan(PricingPlan plan) {
        plan.setPricingConfig(this);
        plans.add(plan);
    }

    public void addRule(PricingRule rule) {
        rule.setPricingConfig(this);
        rules.add(rule);
    }

    public void addPromotion(Promotion promotion) {
        promotion.setPricingConfig(this);
        promotions.add(promotion);
    }
}
