package com.bikeshare.ride.service;

import com.bikeshare.ride.config.BikeShareProperties;
import com.bikeshare.ride.model.GpsSample;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * GPS trace lookup against the tracking service.
 *
 *   GET {baseUrl}/api/v1/bikes/{bikeId}/trace?from=..&to=..
 *
 * Circuit breaker + retry guard the HTTP call; once they give up the
 * fallback returns an empty trace and the ride is billed on straight-line
 * distance. With no base URL configured every lookup is empty.
 */
@Slf4j
@Component
public class HttpGpsTrackProvider implements GpsTrackProvider {

    private final RestClient restClient;

    public HttpGpsTrackProvider(BikeShareProperties properties, RestClient.Builder builder) {
        BikeShareProperties.Gps gps = properties.getGps();
        if (StringUtils.hasText(gps.getBaseUrl())) {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout((int) gps.getTimeout().toMillis());
            requestFactory.setReadTimeout((int) gps.getTimeout().toMillis());
            this.restClient = builder.baseUrl(gps.getBaseUrl()).requestFactory(requestFactory).build();
        } else {
            log.info("No GPS tracking service configured, rides are billed on straight-line distance");
            this.restClient = null;
        }
    }

    @Override
    @CircuitBreaker(name = "gps-provider", fallbackMethod = "traceFallback")
    @Retry(name = "gps-retry")
    public List<GpsSample> getTrace(UUID bikeId, Instant from, Instant to) {
        if (restClient == null) {
            return List.of();
        }
        GpsSample[] samples = restClient.get()
                .uri(uri -> uri.path("/api/v1/bikes/{bikeId}/trace")
                        .queryParam("from", from)
                        .queryParam("to", to)
                        .build(bikeId))
                .retrieve()
                .body(GpsSample[].class);
        if (samples == null) {
            return List.of();
        }
        log.debug("GPS trace for bike {}: {} samples", bikeId, samples.length);
        return Arrays.stream(samples)
                .sorted(Comparator.comparing(GpsSample::timestamp))
                .toList();
    }

    public List<GpsSample> traceFallback(UUID bikeId, Instant from, Instant to, Exception ex) {
        log.warn("GPS trace unavailable for bike {} [{} - {}]: {}", bikeId, from, to, ex.getMessage());
        return List.of();
    }
}
