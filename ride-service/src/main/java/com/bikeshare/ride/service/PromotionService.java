package com.bikeshare.ride.service;

import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.model.PromotionResponse;
import com.bikeshare.ride.repository.PromotionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Promotion redemption. The usage counter only moves here; pricing
 * resolution reads it but never changes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionService {

    private final PromotionRepository promotionRepository;
    private final Clock clock;

    @Transactional
    public PromotionResponse redeem(UUID promotionId) {
        if (promotionRepository.incrementUsageIfAvailable(promotionId, clock.instant()) == 0) {
            throw new BikeShareException(ErrorCode.PROMOTION_NOT_REDEEMABLE,
                    "Promotion " + promotionId + " is missing, inactive, expired or used up");
        }
        PromotionResponse redeemed = promotionRepository.findById(promotionId)
                .map(PromotionResponse::from)
                .orElseThrow(() -> new BikeShareException(ErrorCode.PROMOTION_NOT_REDEEMABLE,
                        "Promotion " + promotionId + " not found"));
        log.info("Promotion {} redeemed, usage {}/{}", promotionId, redeemed.getUsageCount(),
                redeemed.getUsageLimit() != null ? redeemed.getUsageLimit() : "unlimited");
        return redeemed;
    }
}
