package com.bikeshare.ride.service;

import com.bikeshare.ride.entity.Wallet;
import com.bikeshare.ride.repository.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Inserts a rider's empty wallet in its own transaction. When two first
 * calls race, the loser's unique-key violation rolls back only this insert
 * and leaves the caller's transaction usable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WalletProvisioner {

    private final WalletRepository walletRepository;

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when the rider already has a wallet
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Wallet create(String riderId, String currency) {
        Wallet created = walletRepository.saveAndFlush(Wallet.builder()
                .riderId(riderId)
                .balance(BigDecimal.ZERO)
                .currency(currency)
                .build());
        log.info("Created wallet {} for rider {}", created.getId(), riderId);
        return created;
    }
}
