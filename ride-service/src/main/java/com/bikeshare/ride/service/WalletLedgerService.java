package com.bikeshare.ride.service;

import com.bikeshare.ride.entity.Wallet;
import com.bikeshare.ride.entity.WalletTransaction;
import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.model.WalletReconciliation;
import com.bikeshare.ride.repository.WalletRepository;
import com.bikeshare.ride.repository.WalletTransactionRepository;
import com.bikeshare.shared.enums.TransactionStatus;
import com.bikeshare.shared.enums.TransactionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-rider balance plus an append-only transaction log.
 *
 * Every balance change runs under a PESSIMISTIC_WRITE lock on the wallet row
 * and writes its COMPLETED transaction row in the same transaction, so the
 * balance always equals the signed sum of completed transactions.
 * Wallets are created on first credit or first lock; a rider without one reads as 0.
 * Creation runs in its own transaction (WalletProvisioner) so concurrent first
 * calls for a new rider all end up locking the same row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletLedgerService {

    static final String DEFAULT_CURRENCY = "USD";
    private static final String REFUND_REASON = "refund";

    private final WalletRepository walletRepository;
    private final WalletTransactionRepository transactionRepository;
    private final WalletProvisioner walletProvisioner;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public BigDecimal balance(String riderId) {
        return walletRepository.findByRiderId(riderId)
                .map(Wallet::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    @Transactional(readOnly = true)
    public Wallet getWallet(String riderId) {
        return walletRepository.findByRiderId(riderId)
                .orElseGet(() -> Wallet.builder()
                        .riderId(riderId)
                        .balance(BigDecimal.ZERO)
                        .currency(DEFAULT_CURRENCY)
                        .build());
    }

    /**
     * Locks the rider's wallet row for the rest of the caller's transaction,
     * creating an empty wallet first if the rider has none.
     */
    @Transactional
    public Wallet lockWallet(String riderId) {
        return walletRepository.findByRiderIdForUpdate(riderId)
                .orElseGet(() -> {
                    try {
                        walletProvisioner.create(riderId, DEFAULT_CURRENCY);
                    } catch (DataIntegrityViolationException e) {
                        log.debug("Wallet for rider {} was created concurrently", riderId);
                    }
                    return walletRepository.findByRiderIdForUpdate(riderId)
                            .orElseThrow(() -> new IllegalStateException("Wallet for rider " + riderId + " missing after creation"));
                });
    }

    /**
     * Takes {@code amount} out of the wallet, rejecting the whole operation
     * when the balance does not cover it.
     *
     * @return the balance after the debit
     */
    @Transactional
    public BigDecimal debit(String riderId, BigDecimal amount, TransactionType type,
                            UUID rideId, Map<String, Object> metadata) {
        if (type.isCredit()) {
            throw new IllegalArgumentException("Not a debit transaction type: " + type);
        }
        requireNonNegative(amount);

        Wallet wallet = lockWallet(riderId);
        if (wallet.getBalance().compareTo(amount) < 0) {
            throw new BikeShareException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Balance " + wallet.getBalance() + " does not cover " + amount);
        }

        wallet.setBalance(wallet.getBalance().subtract(amount));
        walletRepository.save(wallet);
        append(wallet, type, amount, null, rideId, metadata);

        log.info("Debited {} ({}) from rider {} wallet, balance now {}", amount, type, riderId, wallet.getBalance());
        return wallet.getBalance();
    }

    /**
     * Adds funds. Reason {@code refund} records a REFUND; any other reason
     * (top-up, promotion, bonus) records a DEPOSIT.
     *
     * @return the balance after the credit
     */
    @Transactional
    public BigDecimal credit(String riderId, BigDecimal amount, String reason,
                             String paymentMethod, Map<String, Object> metadata) {
        if (amount == null || amount.signum() <= 0) {
            throw new BikeShareException(ErrorCode.INVALID_AMOUNT, "Credit amount must be positive");
        }
        TransactionType type = REFUND_REASON.equalsIgnoreCase(reason) ? TransactionType.REFUND : TransactionType.DEPOSIT;

        Map<String, Object> details = new LinkedHashMap<>();
        if (metadata != null) {
            details.putAll(metadata);
        }
        if (reason != null) {
            details.put("reason", reason);
        }

        Wallet wallet = lockWallet(riderId);
        wallet.setBalance(wallet.getBalance().add(amount));
        walletRepository.save(wallet);
        append(wallet, type, amount, paymentMethod, null, details);

        log.info("Credited {} ({}) to rider {} wallet, balance now {}", amount, type, riderId, wallet.getBalance());
        return wallet.getBalance();
    }

    @Transactional(readOnly = true)
    public Page<WalletTransaction> transactionHistory(String riderId, int page, int size) {
        PageRequest pageable = PageRequest.of(page, size);
        return walletRepository.findByRiderId(riderId)
                .map(w -> transactionRepository.findByWalletIdOrderByCreatedAtDesc(w.getId(), pageable))
                .orElseGet(() -> Page.empty(pageable));
    }

    /**
     * Compares the stored balance with the signed sum of completed transactions.
     */
    @Transactional(readOnly = true)
    public WalletReconciliation reconcile(String riderId) {
        Wallet wallet = walletRepository.findByRiderId(riderId).orElse(null);
        if (wallet == null) {
            return new WalletReconciliation(riderId, BigDecimal.ZERO, BigDecimal.ZERO, true);
        }
        BigDecimal ledgerSum = transactionRepository
                .findByWalletIdAndStatus(wallet.getId(), TransactionStatus.COMPLETED).stream()
                .map(WalletTransaction::signedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        boolean consistent = ledgerSum.compareTo(wallet.getBalance()) == 0;
        if (!consistent) {
            log.error("Wallet {} for rider {} out of balance: stored={} ledger={}",
                    wallet.getId(), riderId, wallet.getBalance(), ledgerSum);
        }
        return new WalletReconciliation(riderId, wallet.getBalance(), ledgerSum, consistent);
    }

    private void append(Wallet wallet, TransactionType type, BigDecimal amount, String paymentMethod,
                        UUID rideId, Map<String, Object> metadata) {
        transactionRepository.save(WalletTransaction.builder()
                .walletId(wallet.getId())
                .type(type)
                .amount(amount)
                .fees(BigDecimal.ZERO)
                .totalAmount(amount)
                .status(TransactionStatus.COMPLETED)
                .paymentMethod(paymentMethod != null ? paymentMethod : "WALLET")
                .rideId(rideId)
                .metadata(toJson(wallet.getId(), metadata))
                .build());
    }

    private String toJson(UUID walletId, Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise transaction metadata for wallet {}: {}", walletId, e.getMessage(), e);
            throw new IllegalStateException("Transaction metadata serialisation failed", e);
        }
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new BikeShareException(ErrorCode.INVALID_AMOUNT, "Amount must not be negative");
        }
    }
}
