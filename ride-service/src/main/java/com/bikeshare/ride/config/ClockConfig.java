package com.bikeshare.ride.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(BikeShareProperties properties) {
        String zone = properties.getPricing().getZone();
        return StringUtils.hasText(zone) ? Clock.system(ZoneId.of(zone)) : Clock.systemDefaultZone();
    }
}
