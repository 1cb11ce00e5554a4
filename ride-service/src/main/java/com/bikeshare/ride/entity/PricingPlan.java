package com.bikeshare.ride.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "pricing_plans")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PricingPlan {

    public enum PlanType { HOURLY, DAILY, WEEKLY, MONTHLY }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pricing_config_id", nullable = false)
    @ToString.Exclude
    private PricingConfig pricingConfig;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_type", nullable = false, length = 16)
    @Builder.Default
    private PlanType planType = PlanType.HOURLY;

    @Column(name = "hourly_rate", nullable = false, precision = 12, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "daily_rate", nullable = false, precision = 12, scale = 2)
    private BigDecimal dailyRate;

    @Column(name = "weekly_rate", nullable = false, precision = 12, scale = 2)
    private BigDecimal weeklyRate;

    @Column(name = "monthly_rate", nullable = false, precision = 12, scale = 2)
    private BigDecimal monthlyRate;

    @Column(name = "minimum_hours", nullable = false)
    @Builder.Default
    private int minimumHours = 1;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    /** Promotions attached to this plan, oldest first; this is their stacking order. */
    @ManyToMany(mappedBy = "plans")
    @OrderBy("createdAt ASC, id ASC")
    @Builder.Default
    @ToString.Exclude
    private List<Promotion> promotions = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
