package com.bikeshare.ride.model;

import com.bikeshare.ride.entity.Promotion.DiscountType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionRequest {

    @NotBlank
    private String name;

    private String description;

    @NotNull
    private DiscountType discountType;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal discountValue;

    @NotNull
    private Instant startDate;

    @NotNull
    private Instant endDate;

    @Min(1)
    private Integer usageLimit;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private List<UUID> planIds = new ArrayList<>();
}
