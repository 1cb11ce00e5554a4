package com.bikeshare.ride.service;

import com.bikeshare.ride.exception.BikeShareException;
import com.bikeshare.ride.exception.ErrorCode;
import com.bikeshare.ride.model.GpsSample;
import com.bikeshare.shared.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Ride duration, distance and fare arithmetic. No I/O; the GPS trace is handed in.
 *
 * Flat fare:
 *   fare = round2(perMinuteRate * durationMinutes + unlockFee)
 * Plan fare:
 *   fare = round2(hourlyRate / 60 * durationMinutes + unlockFee)
 */
@Slf4j
@Service
public class FareCalculatorService {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);
    /** A trace longer than this multiple of the straight line is treated as noise. */
    private static final double MAX_TRACE_FACTOR = 3.0;

    public double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        return GeoUtil.distanceKm(lat1, lng1, lat2, lng2);
    }

    /**
     * Sum of great-circle segments between consecutive samples; 0 for fewer than two samples.
     */
    public double traceDistanceKm(List<GpsSample> trace) {
        if (trace == null || trace.size() < 2) {
            return 0.0;
        }
        double total = 0.0;
        for (int i = 1; i < trace.size(); i++) {
            GpsSample prev = trace.get(i - 1);
            GpsSample cur = trace.get(i);
            total += GeoUtil.distanceKm(prev.latitude(), prev.longitude(), cur.latitude(), cur.longitude());
        }
        return total;
    }

    /**
     * Prefers the traced path length only when it is longer than the straight
     * line and shorter than three times it.
     */
    public double reconcileDistance(double straightLineKm, List<GpsSample> trace) {
        if (trace == null || trace.size() < 2) {
            return straightLineKm;
        }
        double traced = traceDistanceKm(trace);
        if (traced > straightLineKm && traced < straightLineKm * MAX_TRACE_FACTOR) {
            log.debug("Adopting GPS distance {}km over straight line {}km", traced, straightLineKm);
            return traced;
        }
        log.debug("Ignoring GPS distance {}km, straight line {}km kept", traced, straightLineKm);
        return straightLineKm;
    }

    /**
     * Whole minutes between start and end, rounded down.
     */
    public int durationMinutes(Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new BikeShareException(ErrorCode.INVALID_TIME_RANGE,
                    "Ride end " + end + " is before its start " + start);
        }
        return (int) (Duration.between(start, end).getSeconds() / 60);
    }

    public BigDecimal flatFare(int durationMinutes, BigDecimal perMinuteRate, BigDecimal unlockFee) {
        return perMinuteRate.multiply(BigDecimal.valueOf(durationMinutes))
                .add(unlockFee)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal planFare(int durationMinutes, BigDecimal hourlyRate, BigDecimal unlockFee) {
        return hourlyRate.multiply(BigDecimal.valueOf(durationMinutes))
                .divide(MINUTES_PER_HOUR, 10, RoundingMode.HALF_UP)
                .add(unlockFee)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal roundDistance(double km) {
        return BigDecimal.valueOf(km).setScale(2, RoundingMode.HALF_UP);
    }
}
