package com.bikeshare.ride.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopUpRequest {

    @NotNull
    @DecimalMin("0.01")
    private BigDecimal amount;

    /** "top-up", "promotion", "bonus" or "refund". */
    private String reason = "top-up";

    private String paymentMethod = "CARD";
}
