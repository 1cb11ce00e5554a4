package com.bikeshare.ride.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Time-window multiplier. {@code dayOfWeek} uses 0 = Sunday .. 6 = Saturday;
 * null matches every day. Null start/end hours match every hour. A window with
 * startHour > endHour crosses midnight.
 */
@Entity
@Table(name = "pricing_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PricingRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pricing_config_id", nullable = false)
    @ToString.Exclude
    private PricingConfig pricingConfig;

    @Column(nullable = false)
    private String name;

    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "start_hour")
    private Integer startHour;

    @Column(name = "end_hour")
    private Integer endHour;

    @Column(name = "multiplier", nullable = false, precision = 8, scale = 3)
    @Builder.Default
    private BigDecimal multiplier = BigDecimal.ONE;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "priority", nullable = false)
    private int priority;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
