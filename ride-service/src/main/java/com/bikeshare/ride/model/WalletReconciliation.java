package com.bikeshare.ride.model;

import java.math.BigDecimal;

/**
 * Stored balance next to the signed sum of completed ledger rows.
 */
public record WalletReconciliation(String riderId, BigDecimal balance, BigDecimal ledgerSum, boolean consistent) {
}
