package com.bikeshare.ride.model;

import java.math.BigDecimal;

public record WalletBalanceResponse(String riderId, BigDecimal balance, String currency) {
}
