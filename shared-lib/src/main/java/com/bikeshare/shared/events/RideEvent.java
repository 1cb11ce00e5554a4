package com.bikeshare.shared.events;

import com.bikeshare.shared.enums.RideStatus;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEvent {

    private String rideId;
    private String riderId;
    private String bikeId;
    private String eventType;
    private RideStatus status;
    private BigDecimal cost;
    private Integer durationMinutes;
    private BigDecimal distanceKm;
    private BigDecimal balanceAfter;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant eventTime;
}
