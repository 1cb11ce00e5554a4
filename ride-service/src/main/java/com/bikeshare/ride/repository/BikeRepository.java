package com.bikeshare.ride.repository;

import com.bikeshare.ride.entity.Bike;
import com.bikeshare.shared.enums.BikeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface BikeRepository extends JpaRepository<Bike, UUID> {

    /**
     * Compare-and-swap on bike status.
     *
     * @return 1 if the bike was in {@code expected} and is now {@code target}, 0 otherwise
     */
    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Bike b SET b.status = :target, b.updatedAt = :now "
            + "WHERE b.id = :id AND b.status = :expected")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") BikeStatus expected,
                            @Param("target") BikeStatus target,
                            @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Bike b SET b.latitude = :lat, b.longitude = :lng, b.updatedAt = :now WHERE b.id = :id")
    int updateLocation(@Param("id") UUID id,
                       @Param("lat") double lat,
                       @Param("lng") double lng,
                       @Param("now") Instant now);
}
