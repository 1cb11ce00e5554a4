package com.bikeshare.shared.enums;

/**
 * Wallet transaction kinds. The sign says how a COMPLETED transaction of this
 * type moves the wallet balance.
 */
public enum TransactionType {
    DEPOSIT(1),
    REFUND(1),
    WITHDRAWAL(-1),
    RIDE_PAYMENT(-1);

    private final int sign;

    TransactionType(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    public boolean isCredit() {
        return sign > 0;
    }
}
