package com.bikeshare.ride.repository;

import com.bikeshare.ride.entity.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, UUID> {

    Optional<Wallet> findByRiderId(String riderId);

    /**
     * Wallet row with a pessimistic write lock. Every balance mutation and
     * every ride transition for the rider goes through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.riderId = :riderId")
    Optional<Wallet> findByRiderIdForUpdate(@Param("riderId") String riderId);
}
