package com.bikeshare.ride.repository;

import com.bikeshare.ride.entity.WalletTransaction;
import com.bikeshare.shared.enums.TransactionStatus;
import com.bikeshare.shared.enums.TransactionType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, UUID> {

    Page<WalletTransaction> findByWalletIdOrderByCreatedAtDesc(UUID walletId, Pageable pageable);

    List<WalletTransaction> findByWalletIdAndStatus(UUID walletId, TransactionStatus status);

    List<WalletTransaction> findByRideIdAndType(UUID rideId, TransactionType type);
}
