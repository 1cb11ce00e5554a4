package com.bikeshare.ride.entity;

import com.bikeshare.shared.enums.TransactionStatus;
import com.bikeshare.shared.enums.TransactionType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only ledger row. Written in the same transaction as the wallet
 * balance change it records.
 */
@Entity
@Table(name = "wallet_transactions",
        indexes = {
                @Index(name = "idx_wtx_wallet", columnList = "wallet_id"),
                @Index(name = "idx_wtx_ride", columnList = "ride_id"),
                @Index(name = "idx_wtx_created_at", columnList = "created_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class WalletTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "wallet_id", nullable = false)
    private UUID walletId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 24)
    private TransactionType type;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "fees", nullable = false, precision = 14, scale = 2)
    @Builder.Default
    private BigDecimal fees = BigDecimal.ZERO;

    @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TransactionStatus status;

    @Column(name = "payment_method", length = 32)
    private String paymentMethod;

    /** Originating ride, when the movement settles one. */
    @Column(name = "ride_id")
    private UUID rideId;

    @Column(name = "metadata", length = 4000)
    private String metadata; // JSON

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public BigDecimal signedAmount() {
        return type.isCredit() ? amount : amount.negate();
    }
}
