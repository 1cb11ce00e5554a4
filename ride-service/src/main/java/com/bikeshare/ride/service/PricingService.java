package com.bikeshare.ride.service;

import com.bikeshare.ride.entity.PricingConfig;
import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.model.PricingSnapshot;
import com.bikeshare.ride.repository.PricingConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;

/**
 * Loads the active pricing configuration once per call and hands it to
 * {@link PricingResolver}. Dates and hours are in the clock's zone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PricingService {

    private final PricingConfigRepository configRepository;
    private final PricingResolver resolver;
    private final Clock clock;

    /**
     * @param date target date, today when null
     * @param hour target hour 0-23, the current hour when null
     */
    public PricingSnapshot resolvePricing(LocalDate date, Integer hour) {
        LocalDateTime local = LocalDateTime.now(clock);
        LocalDate targetDate = date != null ? date : local.toLocalDate();
        int targetHour = hour != null ? hour : local.getHour();
        return resolver.resolve(activeConfig(), targetDate, targetHour, clock.instant());
    }

    /**
     * Rates in force during the hour containing {@code at}.
     */
    public PricingSnapshot resolveAt(Instant at) {
        ZonedDateTime zoned = at.atZone(clock.getZone());
        return resolvePricing(zoned.toLocalDate(), zoned.getHour());
    }

    PricingConfig activeConfig() {
        return configRepository.findFirstByActiveTrueOrderByCreatedAtDesc()
                .orElseThrow(() -> new BikeShareException(ErrorCode.NO_PRICING_CONFIG,
                        "No active pricing configuration"));
    }
}
