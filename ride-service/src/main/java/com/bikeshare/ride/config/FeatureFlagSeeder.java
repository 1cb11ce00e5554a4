package com.bikeshare.ride.config;

import com.bikeshare.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Seeds missing flag defaults for every tenant in {@code bikeshare.flags.tenants}
 * once the service is ready. Values already in Redis are left alone.
 *
 * A tenant that cannot be seeded keeps reading the caller defaults, so a Redis
 * outage at startup is logged and does not stop the service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "bikeshare.flags", name = "seed-on-startup", havingValue = "true", matchIfMissing = true)
public class FeatureFlagSeeder {

    private final FeatureFlagService featureFlagService;
    private final BikeShareProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        seed();
    }

    /**
     * @return number of tenants seeded
     */
    int seed() {
        int seeded = 0;
        for (String tenant : properties.getFlags().getTenants()) {
            if (tenant == null || tenant.isBlank()) {
                continue;
            }
            try {
                featureFlagService.initDefaults(tenant.trim());
                seeded++;
            } catch (DataAccessException e) {
                log.warn("Could not seed feature flags for tenant {}: {}", tenant, e.getMessage());
            }
        }
        log.info("Feature flags seeded for {} of {} tenants", seeded, properties.getFlags().getTenants().size());
        return seeded;
    }
}
