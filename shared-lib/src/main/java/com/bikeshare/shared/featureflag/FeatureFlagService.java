package com.bikeshare.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Runtime switches kept in Redis hashes, one hash per tenant.
 *
 *   key    feature-flags:{tenantId}
 *   field  {flagName}
 *   value  "true" | "false"
 *
 * Lookup order is tenant, then the {@code global} hash, then the caller's default.
 * Registered by FeatureFlagAutoConfiguration. Toggle at runtime:
 *   HSET feature-flags:default dynamic_fare_pricing true
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    public static final String DEFAULT_TENANT = "default";

    /** Prices rides with the pricing resolver instead of the flat fare. */
    public static final String DYNAMIC_FARE_PRICING = "dynamic_fare_pricing";
    /** Replaces straight-line ride distance with the GPS trace when plausible. */
    public static final String GPS_DISTANCE_CORRECTION = "gps_distance_correction";

    private static final String KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_TENANT = "global";
    private static final Duration FLAG_TTL = Duration.ofDays(365);

    private final RedisTemplate<String, String> redisTemplate;

    public boolean isEnabled(String tenantId, String flagName, boolean defaultValue) {
        Optional<Boolean> value = lookup(tenantId, flagName).or(() -> lookup(GLOBAL_TENANT, flagName));
        if (value.isEmpty()) {
            log.debug("Flag {} unset for tenant {}, default {} applies", flagName, tenantId, defaultValue);
        }
        return value.orElse(defaultValue);
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_TENANT, flagName, defaultValue);
    }

    public void setFlag(String tenantId, String flagName, boolean value) {
        hash().put(KEY_PREFIX + tenantId, flagName, Boolean.toString(value));
        log.info("Flag {}={} for tenant {}", flagName, value, tenantId);
    }

    /**
     * Seeds flags that are not yet set. {@code dynamic_fare_pricing} stays
     * unset so the configured fare mode applies until someone flips it.
     */
    public void initDefaults(String tenantId) {
        String key = KEY_PREFIX + tenantId;
        hash().putIfAbsent(key, GPS_DISTANCE_CORRECTION, "true");
        redisTemplate.expire(key, FLAG_TTL);
    }

    private Optional<Boolean> lookup(String tenantId, String flagName) {
        return Optional.ofNullable(hash().get(KEY_PREFIX + tenantId, flagName))
                .map(v -> Boolean.parseBoolean(v.toString()));
    }

    private HashOperations<String, Object, Object> hash() {
        return redisTemplate.opsForHash();
    }
}
