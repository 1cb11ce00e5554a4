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
@Table(name = "promotions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Promotion {

    public enum DiscountType { PERCENTAGE, FIXED_AMOUNT }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pricing_config_id", nullable = false)
    @ToString.Exclude
    private PricingConfig pricingConfig;

    @Column(nullable = false)
    private String name;

    @Column(name = "description")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", nullable = false, length = 16)
    @Builder.Default
    private DiscountType discountType = DiscountType.PERCENTAGE;

    @Column(name = "discount_value", nullable = false, precision = 12, scale = 2)
    private BigDecimal discountValue;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "end_date", nullable = false)
    private Instant endDate;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /** Null means unlimited. */
    @Column(name = "usage_limit")
    private Integer usageLimit;

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @ManyToMany
    @JoinTable(name = "promotion_plans",
            joinColumns = @JoinColumn(name = "promotion_id"),
            inverseJoinColumns = @JoinColumn(name = "plan_id"),
            uniqueConstraints = @UniqueConstraint(columnNames = {"promotion_id", "plan_id"}))
    @Builder.Default
    @ToString.Exclude
    private List<PricingPlan> plans = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public boolean isValidAt(Instant now) {
        return active && !startDate.isAfter(now) && !endDate.isBefore(now);
    }

    public boolean hasUsageLeft() {
        return usageLimit == null || usageCount < usageLimit;
    }
}
