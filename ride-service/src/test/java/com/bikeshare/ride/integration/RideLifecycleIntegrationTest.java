package com.bikeshare.ride.integration;

import com.bikeshare.ride.RideServiceApplication;
import com.bikeshare.ride.entity.Bike;
import com.bikeshare.ride.entity.Ride;
import com.bikeshare.ride.entity.WalletTransaction;
import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.model.EndRideRequest;
import com.bikeshare.ride.model.StartRideRequest;
import com.bikeshare.ride.repository.BikeRepository;
import com.bikeshare.ride.repository.RideRepository;
import com.bikeshare.ride.repository.WalletTransactionRepository;
import com.bikeshare.ride.service.BikeRegistry;
import com.bikeshare.ride.service.GpsTrackProvider;
import com.bikeshare.ride.service.NotificationSink;
import com.bikeshare.ride.service.RideService;
import com.bikeshare.ride.service.WalletLedgerService;
import com.bikeshare.ride.support.MutableClock;
import com.bikeshare.shared.enums.BikeStatus;
import com.bikeshare.shared.enums.RideStatus;
import com.bikeshare.shared.enums.TransactionType;
import com.bikeshare.shared.events.RideEvent;
import com.bikeshare.shared.featureflag.FeatureFlagService;
import com.bikeshare.shared.util.KafkaTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Ride lifecycle through real JPA (H2) and real transactions.
 *
 * Redis, Redisson, the GPS tracker and Kafka are replaced with mocks; feature
 * flags read as unset, so fares are flat (0.50/min + 1.00) and GPS correction is off.
 */
@SpringBootTest(classes = {RideServiceApplication.class, TestClockConfig.class})
@ActiveProfiles("test")
class RideLifecycleIntegrationTest {

    // ── Infrastructure mocks ─────────────────────────────────────────────────
    @MockBean private RedissonClient redissonClient;
    @MockBean private FeatureFlagService featureFlagService;
    @MockBean private GpsTrackProvider gpsTrackProvider;
    @MockBean private NotificationSink notificationSink;
    @SpyBean private BikeRegistry bikeRegistry;

    @Autowired private RideService rideService;
    @Autowired private WalletLedgerService walletLedger;
    @Autowired private RideRepository rideRepository;
    @Autowired private BikeRepository bikeRepository;
    @Autowired private WalletTransactionRepository transactionRepository;
    @Autowired private MutableClock clock;

    @BeforeEach
    void setUp() throws InterruptedException {
        clock.set(TestClockConfig.EPOCH);

        RLock lock = mock(RLock.class);
        when(redissonClient.getLock(anyString())).thenReturn(lock);
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);
    }

    private UUID newBike(BikeStatus status) {
        return bikeRepository.save(Bike.builder()
                .code("BK-" + UUID.randomUUID())
                .model("City")
                .status(status)
                .batteryLevel(90)
                .latitude(48.8566)
                .longitude(2.3522)
                .build()).getId();
    }

    private static String newRider() {
        return "rider-" + UUID.randomUUID();
    }

    private static StartRideRequest startAt(String riderId, UUID bikeId) {
        return new StartRideRequest(riderId, bikeId, 48.8566, 2.3522);
    }

    private static final EndRideRequest END = new EndRideRequest(48.8656, 2.3522);

    private List<WalletTransaction> ridePayments(UUID rideId) {
        return transactionRepository.findByRideIdAndType(rideId, TransactionType.RIDE_PAYMENT);
    }

    @Test
    @DisplayName("Rider with 20.00 rides 20 minutes: pays 11.00, bike is free at the drop-off point")
    void happyPath() {
        String rider = newRider();
        UUID bikeId = newBike(BikeStatus.AVAILABLE);
        walletLedger.credit(rider, new BigDecimal("20.00"), "top-up", "CARD", Map.of());

        Ride started = rideService.startRide(startAt(rider, bikeId));
        assertThat(bikeRepository.findById(bikeId).orElseThrow().getStatus()).isEqualTo(BikeStatus.IN_USE);
        assertThat(rideService.getActiveRide(rider)).map(Ride::getId).contains(started.getId());

        clock.advance(Duration.ofMinutes(20));
        Ride ended = rideService.endRide(started.getId(), END);

        assertThat(ended.getStatus()).isEqualTo(RideStatus.COMPLETED);
        assertThat(ended.getCost()).isEqualByComparingTo("11.00");
        assertThat(walletLedger.balance(rider)).isEqualByComparingTo("9.00");
        assertThat(rideService.getActiveRide(rider)).isEmpty();

        Bike bike = bikeRepository.findById(bikeId).orElseThrow();
        assertThat(bike.getStatus()).isEqualTo(BikeStatus.AVAILABLE);
        assertThat(bike.getLatitude()).isEqualTo(48.8656);

        List<WalletTransaction> history = walletLedger.transactionHistory(rider, 0, 10).getContent();
        assertThat(history).extracting(WalletTransaction::getType)
                .containsExactlyInAnyOrder(TransactionType.DEPOSIT, TransactionType.RIDE_PAYMENT);
        assertThat(walletLedger.reconcile(rider).consistent()).isTrue();
        assertThat(ridePayments(started.getId())).singleElement()
                .satisfies(t -> assertThat(t.getAmount()).isEqualByComparingTo("11.00"));

        verify(notificationSink).publish(eq(rider), eq(KafkaTopics.RIDE_COMPLETED), any(RideEvent.class));
    }

    @Test
    @DisplayName("End fails on 10.00, rider tops up 5.00, end succeeds leaving 4.00")
    void insufficientThenTopUp() {
        String rider = newRider();
        UUID bikeId = newBike(BikeStatus.AVAILABLE);
        walletLedger.credit(rider, new BigDecimal("10.00"), "top-up", "CARD", Map.of());

        Ride ride = rideService.startRide(startAt(rider, bikeId));
        clock.advance(Duration.ofMinutes(20));

        assertThatThrownBy(() -> rideService.endRide(ride.getId(), END))
                .isInstanceOf(BikeShareException.class)
                .satisfies(e -> assertThat(((BikeShareException) e).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE));

        assertThat(rideService.getRide(ride.getId()).getStatus()).isEqualTo(RideStatus.IN_PROGRESS);
        assertThat(bikeRepository.findById(bikeId).orElseThrow().getStatus()).isEqualTo(BikeStatus.IN_USE);
        assertThat(walletLedger.balance(rider)).isEqualByComparingTo("10.00");
        assertThat(ridePayments(ride.getId())).isEmpty();

        walletLedger.credit(rider, new BigDecimal("5.00"), "top-up", "CARD", Map.of());
        Ride ended = rideService.endRide(ride.getId(), END);

        assertThat(ended.getCost()).isEqualByComparingTo("11.00");
        assertThat(walletLedger.balance(rider)).isEqualByComparingTo("4.00");
        assertThat(ridePayments(ride.getId())).hasSize(1);
        assertThat(bikeRepository.findById(bikeId).orElseThrow().getStatus()).isEqualTo(BikeStatus.AVAILABLE);
        assertThat(walletLedger.reconcile(rider).consistent()).isTrue();
    }

    @Test
    @DisplayName("Second end on the same ride fails with RIDE_NOT_ACTIVE and charges nothing more")
    void doubleEnd() {
        String rider = newRider();
        walletLedger.credit(rider, new BigDecimal("20.00"), "top-up", "CARD", Map.of());
        Ride ride = rideService.startRide(startAt(rider, newBike(BikeStatus.AVAILABLE)));
        clock.advance(Duration.ofMinutes(4));

        rideService.endRide(ride.getId(), END);
        clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> rideService.endRide(ride.getId(), END))
                .satisfies(e -> assertThat(((BikeShareException) e).getCode()).isEqualTo(ErrorCode.RIDE_NOT_ACTIVE));
        assertThat(walletLedger.balance(rider)).isEqualByComparingTo("17.00");
        assertThat(ridePayments(ride.getId())).hasSize(1);
    }

    @Test
    @DisplayName("A second ride for the same rider is refused while one is in progress")
    void oneActiveRidePerRider() {
        String rider = newRider();
        walletLedger.credit(rider, new BigDecimal("20.00"), "top-up", "CARD", Map.of());
        rideService.startRide(startAt(rider, newBike(BikeStatus.AVAILABLE)));
        UUID secondBike = newBike(BikeStatus.AVAILABLE);

        assertThatThrownBy(() -> rideService.startRide(startAt(rider, secondBike)))
                .satisfies(e -> assertThat(((BikeShareException) e).getCode()).isEqualTo(ErrorCode.RIDE_ALREADY_ACTIVE));
        assertThat(bikeRepository.findById(secondBike).orElseThrow().getStatus()).isEqualTo(BikeStatus.AVAILABLE);
    }

    @Test
    @DisplayName("New rider without a wallet cannot start: balance reads as 0")
    void riderWithoutWallet() {
        String rider = newRider();
        UUID bikeId = newBike(BikeStatus.AVAILABLE);

        assertThatThrownBy(() -> rideService.startRide(startAt(rider, bikeId)))
                .satisfies(e -> assertThat(((BikeShareException) e).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE));
        assertThat(walletLedger.balance(rider)).isEqualByComparingTo("0");
        assertThat(bikeRepository.findById(bikeId).orElseThrow().getStatus()).isEqualTo(BikeStatus.AVAILABLE);
    }

    @Test
    @DisplayName("Failure after the debit rolls back payment, ride completion and bike release together")
    void settlementRollsBackAsOneUnit() {
        String rider = newRider();
        UUID bikeId = newBike(BikeStatus.AVAILABLE);
        walletLedger.credit(rider, new BigDecimal("20.00"), "top-up", "CARD", Map.of());
        Ride ride = rideService.startRide(startAt(rider, bikeId));
        clock.advance(Duration.ofMinutes(20));

        doThrow(new DataAccessResourceFailureException("fleet table unavailable"))
                .when(bikeRegistry).updateLocation(eq(bikeId), anyDouble(), anyDouble());

        assertThatThrownBy(() -> rideService.endRide(ride.getId(), END))
                .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(rideService.getRide(ride.getId()).getStatus()).isEqualTo(RideStatus.IN_PROGRESS);
        assertThat(bikeRepository.findById(bikeId).orElseThrow().getStatus()).isEqualTo(BikeStatus.IN_USE);
        assertThat(walletLedger.balance(rider)).isEqualByComparingTo("20.00");
        assertThat(walletLedger.transactionHistory(rider, 0, 10).getContent())
                .extracting(WalletTransaction::getType)
                .containsExactly(TransactionType.DEPOSIT);
        assertThat(ridePayments(ride.getId())).isEmpty();
        assertThat(walletLedger.reconcile(rider).consistent()).isTrue();
    }

    @Test
    @DisplayName("Cancelled ride frees the bike and costs nothing")
    void cancel() {
        String rider = newRider();
        UUID bikeId = newBike(BikeStatus.AVAILABLE);
        walletLedger.credit(rider, new BigDecimal("20.00"), "top-up", "CARD", Map.of());
        Ride ride = rideService.startRide(startAt(rider, bikeId));
        clock.advance(Duration.ofMinutes(1));

        rideService.cancelRide(ride.getId(), rider);

        assertThat(rideRepository.findById(ride.getId()).orElseThrow().getStatus()).isEqualTo(RideStatus.CANCELLED);
        assertThat(bikeRepository.findById(bikeId).orElseThrow().getStatus()).isEqualTo(BikeStatus.AVAILABLE);
        assertThat(walletLedger.balance(rider)).isEqualByComparingTo("20.00");
        assertThat(rideService.getRideStats(rider).getCompletedRides()).isZero();
        assertThat(ridePayments(ride.getId())).isEmpty();
    }
}
