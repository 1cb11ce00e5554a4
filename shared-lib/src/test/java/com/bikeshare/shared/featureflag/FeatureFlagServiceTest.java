package com.bikeshare.shared.featureflag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureFlagServiceTest {

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private HashOperations<String, Object, Object> hashOps;

    private FeatureFlagService service;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForHash()).thenReturn(hashOps);
        service = new FeatureFlagService(redisTemplate);
    }

    @Test
    @DisplayName("Tenant value wins over the global one")
    void tenantValueFirst() {
        when(hashOps.get("feature-flags:acme", FeatureFlagService.DYNAMIC_FARE_PRICING)).thenReturn("true");

        assertThat(service.isEnabled("acme", FeatureFlagService.DYNAMIC_FARE_PRICING, false)).isTrue();
        verify(hashOps, never()).get("feature-flags:global", FeatureFlagService.DYNAMIC_FARE_PRICING);
    }

    @Test
    @DisplayName("Global value applies when the tenant has none")
    void globalFallback() {
        when(hashOps.get("feature-flags:default", FeatureFlagService.GPS_DISTANCE_CORRECTION)).thenReturn(null);
        when(hashOps.get("feature-flags:global", FeatureFlagService.GPS_DISTANCE_CORRECTION)).thenReturn("false");

        assertThat(service.isEnabled(FeatureFlagService.GPS_DISTANCE_CORRECTION, true)).isFalse();
    }

    @Test
    @DisplayName("Unset flag returns the caller's default")
    void defaultWhenUnset() {
        assertThat(service.isEnabled(FeatureFlagService.DYNAMIC_FARE_PRICING, true)).isTrue();
        assertThat(service.isEnabled(FeatureFlagService.DYNAMIC_FARE_PRICING, false)).isFalse();
    }

    @Test
    @DisplayName("Seeding only fills missing flags and leaves fare pricing unset")
    void initDefaults() {
        service.initDefaults("default");

        verify(hashOps).putIfAbsent("feature-flags:default", FeatureFlagService.GPS_DISTANCE_CORRECTION, "true");
        verify(hashOps, never()).putIfAbsent("feature-flags:default", FeatureFlagService.DYNAMIC_FARE_PRICING, "true");
        verify(redisTemplate).expire("feature-flags:default", Duration.ofDays(365));
    }

    @Test
    @DisplayName("setFlag stores the value as a string")
    void setFlag() {
        service.setFlag("acme", FeatureFlagService.DYNAMIC_FARE_PRICING, true);

        verify(hashOps).put("feature-flags:acme", FeatureFlagService.DYNAMIC_FARE_PRICING, "true");
    }
}
