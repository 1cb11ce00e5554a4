package com.bikeshare.ride.repository;

import com.bikeshare.ride.entity.Ride;
import com.bikeshare.shared.enums.RideStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RideRepository extends JpaRepository<Ride, UUID> {

    /**
     * Row lock taken by end/cancel so a second settlement attempt waits and
     * then sees the terminal status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Ride r WHERE r.id = :id")
    Optional<Ride> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByRiderIdAndStatus(String riderId, RideStatus status);

    Optional<Ride> findFirstByRiderIdAndStatus(String riderId, RideStatus status);

    Page<Ride> findByRiderIdOrderByStartTimeDesc(String riderId, Pageable pageable);

    List<Ride> findByRiderIdAndStatus(String riderId, RideStatus status);
}
