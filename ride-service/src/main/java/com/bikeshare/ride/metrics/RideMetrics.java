package com.bikeshare.ride.metrics;

import com.bikeshare.ride.exception.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer metrics for the ride lifecycle.
 *
 * Metrics at /actuator/prometheus:
 *   ride_started_total
 *   ride_completed_total
 *   ride_cancelled_total
 *   ride_rejected_total{reason}    precondition failures by error code
 *   ride_settlement_latency_seconds end-ride latency including GPS lookup
 *   ride_fare                       distribution of settled fares
 */
@Component
public class RideMetrics {

    private final MeterRegistry registry;
    private final Counter startedCounter;
    private final Counter completedCounter;
    private final Counter cancelledCounter;
    private final Timer settlementTimer;
    private final DistributionSummary fareSummary;

    public RideMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.startedCounter = Counter.builder("ride.started")
                .description("Rides started")
                .register(registry);

        this.completedCounter = Counter.builder("ride.completed")
                .description("Rides settled and completed")
                .register(registry);

        this.cancelledCounter = Counter.builder("ride.cancelled")
                .description("Rides cancelled without charge")
                .register(registry);

        this.settlementTimer = Timer.builder("ride.settlement.latency")
                .description("End-ride latency including GPS trace lookup and settlement")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofMillis(5))
                .maximumExpectedValue(Duration.ofSeconds(10))
                .register(registry);

        this.fareSummary = DistributionSummary.builder("ride.fare")
                .description("Settled ride fares")
                .register(registry);
    }

    public void recordStarted()   { startedCounter.increment(); }
    public void recordCancelled() { cancelledCounter.increment(); }

    public void recordCompleted(BigDecimal fare) {
        completedCounter.increment();
        fareSummary.record(fare.doubleValue());
    }

    public void recordRejected(ErrorCode reason) {
        Counter.builder("ride.rejected")
                .description("Ride operations rejected by a precondition")
                .tag("reason", reason.name())
                .register(registry)
                .increment();
    }

    public Timer getSettlementTimer() { return settlementTimer; }
}
