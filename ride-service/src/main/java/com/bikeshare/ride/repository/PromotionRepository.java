package com.bikeshare.ride.repository;

import com.bikeshare.ride.entity.Promotion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface PromotionRepository extends JpaRepository<Promotion, UUID> {

    List<Promotion> findAllByOrderByCreatedAtDesc();

    /**
     * Consumes one use of a promotion if it is active, inside its validity
     * window and below its usage limit.
     *
     * @return 1 when a use was recorded, 0 when the promotion is not redeemable
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Promotion p SET p.usageCount = p.usageCount + 1 "
            + "WHERE p.id = :id AND p.active = true "
            + "AND p.startDate <= :now AND p.endDate >= :now "
            + "AND (p.usageLimit IS NULL OR p.usageCount < p.usageLimit)")
    int incrementUsageIfAvailable(@Param("id") UUID id, @Param("now") Instant now);
}
