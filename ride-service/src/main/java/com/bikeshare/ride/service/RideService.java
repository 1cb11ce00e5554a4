package com.bikeshare.ride.service;

import com.bikeshare.ride.config.BikeShareProperties;
import com.bikeshare.ride.entity.Ride;
import com.bikeshare.ride.entity.Wallet;
import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.metrics.RideMetrics;
import com.bikeshare.ride.model.BikeSnapshot;
import com.bikeshare.ride.model.EndRideRequest;
import com.bikeshare.ride.model.FareQuote;
import com.bikeshare.ride.model.GpsSample;
import com.bikeshare.ride.model.RideStats;
import com.bikeshare.ride.model.StartRideRequest;
import com.bikeshare.ride.repository.RideRepository;
import com.bikeshare.shared.enums.BikeStatus;
import com.bikeshare.shared.enums.RideStatus;
import com.bikeshare.shared.enums.TransactionType;
import com.bikeshare.shared.events.RideEvent;
import com.bikeshare.shared.featureflag.FeatureFlagService;
import com.bikeshare.shared.util.KafkaTopics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Ride lifecycle: IN_PROGRESS -> COMPLETED | CANCELLED.
 *
 * Start/end/cancel for one rider are serialised twice over: a Redisson lock
 * on {@code lock:rider:{riderId}} around the whole call, and a row lock on the
 * rider's wallet inside the transaction. Bikes are claimed with a
 * compare-and-swap so two riders can never take the same bike.
 *
 * End flow:
 *  1. Duration, distance (GPS-corrected when a trace is available) and fare
 *     are computed outside the transaction.
 *  2. One transaction debits the wallet, completes the ride and releases the bike.
 *  3. The ride.completed event is published after commit, best-effort.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RideService {

    private static final String LOCK_PREFIX = "lock:rider:";

    private final RideRepository rideRepository;
    private final WalletLedgerService walletLedger;
    private final BikeRegistry bikeRegistry;
    private final GpsTrackProvider gpsTrackProvider;
    private final NotificationSink notificationSink;
    private final FareCalculatorService fareCalculator;
    private final FareQuoteService fareQuoteService;
    private final FeatureFlagService featureFlagService;
    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;
    private final BikeShareProperties properties;
    private final RideMetrics metrics;
    private final Clock clock;

    public Ride startRide(StartRideRequest req) {
        Ride ride = rejecting(() -> withRiderLock(req.getRiderId(),
                () -> transactionTemplate.execute(status -> doStart(req))));

        metrics.recordStarted();
        log.info("Ride {} started: rider={} bike={}", ride.getId(), ride.getRiderId(), ride.getBikeId());
        notify(ride, KafkaTopics.RIDE_STARTED, null);
        return ride;
    }

    public Ride endRide(UUID rideId, EndRideRequest req) {
        Timer.Sample sample = Timer.start();
        Settlement settlement = rejecting(() -> {
            Ride ride = rideRepository.findById(rideId)
                    .orElseThrow(() -> rideNotFound(rideId));
            requireActive(ride);

            Instant endedAt = clock.instant();
            int duration = fareCalculator.durationMinutes(ride.getStartTime(), endedAt);
            double straightLine = fareCalculator.distanceKm(
                    ride.getStartLat(), ride.getStartLng(), req.getLatitude(), req.getLongitude());
            double distance = fareCalculator.reconcileDistance(straightLine, fetchTrace(ride, endedAt));
            FareQuote quote = fareQuoteService.quote(ride, duration, fareCalculator.roundDistance(distance));

            return withRiderLock(ride.getRiderId(),
                    () -> transactionTemplate.execute(status -> settle(rideId, endedAt, req, quote)));
        });
        sample.stop(metrics.getSettlementTimer());

        Ride ride = settlement.ride();
        metrics.recordCompleted(ride.getCost());
        log.info("Ride {} completed: rider={} duration={}min distance={}km cost={} balance={}",
                rideId, ride.getRiderId(), ride.getDurationMinutes(), ride.getDistanceKm(),
                ride.getCost(), settlement.balanceAfter());
        notify(ride, KafkaTopics.RIDE_COMPLETED, settlement.balanceAfter());
        return ride;
    }

    public Ride cancelRide(UUID rideId, String riderId) {
        Ride ride = rejecting(() -> withRiderLock(riderId,
                () -> transactionTemplate.execute(status -> doCancel(rideId, riderId))));

        metrics.recordCancelled();
        log.info("Ride {} cancelled by rider {}", rideId, riderId);
        notify(ride, KafkaTopics.RIDE_CANCELLED, null);
        return ride;
    }

    @Transactional(readOnly = true)
    public Ride getRide(UUID rideId) {
        return rideRepository.findById(rideId).orElseThrow(() -> rideNotFound(rideId));
    }

    @Transactional(readOnly = true)
    public Optional<Ride> getActiveRide(String riderId) {
        return rideRepository.findFirstByRiderIdAndStatus(riderId, RideStatus.IN_PROGRESS);
    }

    @Transactional(readOnly = true)
    public Page<Ride> getRiderRides(String riderId, int page, int size) {
        return rideRepository.findByRiderIdOrderByStartTimeDesc(riderId, PageRequest.of(page, size));
    }

    @Transactional(readOnly = true)
    public RideStats getRideStats(String riderId) {
        List<Ride> completed = rideRepository.findByRiderIdAndStatus(riderId, RideStatus.COMPLETED);

        BigDecimal totalDistance = BigDecimal.ZERO;
        BigDecimal totalCost = BigDecimal.ZERO;
        long totalDuration = 0;
        for (Ride ride : completed) {
            totalDistance = totalDistance.add(orZero(ride.getDistanceKm()));
            totalCost = totalCost.add(orZero(ride.getCost()));
            totalDuration += ride.getDurationMinutes() != null ? ride.getDurationMinutes() : 0;
        }

        int count = completed.size();
        BigDecimal rides = BigDecimal.valueOf(Math.max(count, 1));
        return RideStats.builder()
                .riderId(riderId)
                .completedRides(count)
                .totalDistanceKm(totalDistance)
                .averageDistanceKm(totalDistance.divide(rides, 2, RoundingMode.HALF_UP))
                .totalDurationMinutes(totalDuration)
                .averageDurationMinutes(BigDecimal.valueOf(totalDuration).divide(rides, 2, RoundingMode.HALF_UP))
                .totalCost(totalCost)
                .build();
    }

    // --- Transaction bodies ---

    private Ride doStart(StartRideRequest req) {
        String riderId = req.getRiderId();
        Wallet wallet = walletLedger.lockWallet(riderId);

        if (rideRepository.existsByRiderIdAndStatus(riderId, RideStatus.IN_PROGRESS)) {
            throw new BikeShareException(ErrorCode.RIDE_ALREADY_ACTIVE, "Rider " + riderId + " already has a ride in progress");
        }

        BikeSnapshot bike = bikeRegistry.getBike(req.getBikeId())
                .orElseThrow(() -> new BikeShareException(ErrorCode.BIKE_NOT_FOUND, "Bike " + req.getBikeId() + " not found"));
        if (!bike.isAvailable()) {
            throw bikeUnavailable(req.getBikeId(), bike.status());
        }

        BigDecimal minimum = properties.getRide().getMinimumStartBalance();
        if (wallet.getBalance().compareTo(minimum) < 0) {
            throw new BikeShareException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Minimum balance of " + minimum + " required to start a ride, current balance " + wallet.getBalance());
        }

        if (!bikeRegistry.transition(req.getBikeId(), BikeStatus.AVAILABLE, BikeStatus.IN_USE)) {
            throw bikeUnavailable(req.getBikeId(), null);
        }

        return rideRepository.save(Ride.builder()
                .riderId(riderId)
                .bikeId(req.getBikeId())
                .status(RideStatus.IN_PROGRESS)
                .startTime(clock.instant())
                .startLat(req.getLatitude())
                .startLng(req.getLongitude())
                .build());
    }

    private Settlement settle(UUID rideId, Instant endedAt, EndRideRequest req, FareQuote quote) {
        Ride ride = rideRepository.findByIdForUpdate(rideId).orElseThrow(() -> rideNotFound(rideId));
        walletLedger.lockWallet(ride.getRiderId());
        // Re-read under lock: a concurrent end or cancel may have finished first.
        requireActive(ride);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rideId", rideId.toString());
        metadata.put("bikeId", ride.getBikeId().toString());
        metadata.put("durationMinutes", quote.getDurationMinutes());
        metadata.put("distanceKm", quote.getDistanceKm());
        metadata.put("fareMode", quote.getMode().name());
        BigDecimal balanceAfter = walletLedger.debit(
                ride.getRiderId(), quote.getCost(), TransactionType.RIDE_PAYMENT, rideId, metadata);

        ride.complete(endedAt, req.getLatitude(), req.getLongitude(), quote.getDistanceKm(),
                quote.getDurationMinutes(), quote.getCost(), quote.getPricingRule());
        rideRepository.save(ride);

        releaseBike(ride);
        bikeRegistry.updateLocation(ride.getBikeId(), req.getLatitude(), req.getLongitude());
        return new Settlement(ride, balanceAfter);
    }

    private Ride doCancel(UUID rideId, String riderId) {
        Ride ride = rideRepository.findByIdForUpdate(rideId).orElseThrow(() -> rideNotFound(rideId));
        if (!ride.getRiderId().equals(riderId)) {
            // Same answer as a missing ride so ride ids of other riders are not confirmed.
            throw rideNotFound(rideId);
        }
        walletLedger.lockWallet(riderId);
        requireActive(ride);

        ride.cancel(clock.instant());
        rideRepository.save(ride);
        releaseBike(ride);
        return ride;
    }

    // --- Helpers ---

    /**
     * A bike that is no longer IN_USE (e.g. pulled into maintenance mid-ride)
     * keeps its status; the ride still settles.
     */
    private void releaseBike(Ride ride) {
        if (!bikeRegistry.transition(ride.getBikeId(), BikeStatus.IN_USE, BikeStatus.AVAILABLE)) {
            log.warn("Bike {} was not IN_USE when ride {} closed, status left unchanged", ride.getBikeId(), ride.getId());
        }
    }

    private List<GpsSample> fetchTrace(Ride ride, Instant endedAt) {
        if (!featureFlagService.isEnabled(FeatureFlagService.GPS_DISTANCE_CORRECTION, true)) {
            return List.of();
        }
        try {
            return gpsTrackProvider.getTrace(ride.getBikeId(), ride.getStartTime(), endedAt);
        } catch (RuntimeException e) {
            log.warn("GPS trace lookup failed for ride {}, using straight-line distance: {}", ride.getId(), e.getMessage());
            return List.of();
        }
    }

    private <T> T withRiderLock(String riderId, Supplier<T> action) {
        RLock lock = redissonClient.getLock(LOCK_PREFIX + riderId);
        BikeShareProperties.Ride cfg = properties.getRide();
        boolean acquired;
        try {
            acquired = lock.tryLock(cfg.getLockWait().toMillis(), cfg.getLockLease().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BikeShareException(ErrorCode.RIDER_BUSY, "Interrupted waiting for rider " + riderId);
        }
        if (!acquired) {
            throw new BikeShareException(ErrorCode.RIDER_BUSY, "Another request for rider " + riderId + " is in progress");
        }
        try {
            return action.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private <T> T rejecting(Supplier<T> action) {
        try {
            return action.get();
        } catch (BikeShareException e) {
            metrics.recordRejected(e.getCode());
            log.warn("Ride operation rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        }
    }

    private void notify(Ride ride, String eventType, BigDecimal balanceAfter) {
        try {
            notificationSink.publish(ride.getRiderId(), eventType, RideEvent.builder()
                    .rideId(ride.getId().toString())
                    .riderId(ride.getRiderId())
                    .bikeId(ride.getBikeId().toString())
                    .eventType(eventType)
                    .status(ride.getStatus())
                    .cost(ride.getCost())
                    .durationMinutes(ride.getDurationMinutes())
                    .distanceKm(ride.getDistanceKm())
                    .balanceAfter(balanceAfter)
                    .eventTime(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Notification {} for ride {} failed: {}", eventType, ride.getId(), e.getMessage());
        }
    }

    private static void requireActive(Ride ride) {
        if (!ride.isActive()) {
            throw new BikeShareException(ErrorCode.RIDE_NOT_ACTIVE,
                    "Ride " + ride.getId() + " is " + ride.getStatus());
        }
    }

    private static BikeShareException rideNotFound(UUID rideId) {
        return new BikeShareException(ErrorCode.RIDE_NOT_FOUND, "Ride " + rideId + " not found");
    }

    private static BikeShareException bikeUnavailable(UUID bikeId, BikeStatus status) {
        String detail = status != null ? " (" + status + ")" : "";
        return new BikeShareException(ErrorCode.BIKE_UNAVAILABLE, "Bike " + bikeId + " is not available" + detail);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private record Settlement(Ride ride, BigDecimal balanceAfter) {}
}
