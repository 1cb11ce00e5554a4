package com.bikeshare.ride.model;

import com.bikeshare.ride.entity.WalletTransaction;
import com.bikeshare.shared.enums.TransactionStatus;
import com.bikeshare.shared.enums.TransactionType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class TransactionResponse {
    private UUID id;
    private TransactionType type;
    private BigDecimal amount;
    private BigDecimal fees;
    private BigDecimal totalAmount;
    private TransactionStatus status;
    private String paymentMethod;
    private UUID rideId;
    private String metadata;
    private Instant createdAt;

    public static TransactionResponse from(WalletTransaction tx) {
        return TransactionResponse.builder()
                .id(tx.getId())
                .type(tx.getType())
                .amount(tx.getAmount())
                .fees(tx.getFees())
                .totalAmount(tx.getTotalAmount())
                .status(tx.getStatus())
                .paymentMethod(tx.getPaymentMethod())
                .rideId(tx.getRideId())
                .metadata(tx.getMetadata())
                .createdAt(tx.getCreatedAt())
                .build();
    }
}
