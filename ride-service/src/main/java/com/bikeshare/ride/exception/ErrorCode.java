package com.bikeshare.ride.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    RIDE_ALREADY_ACTIVE(HttpStatus.CONFLICT),
    BIKE_NOT_FOUND(HttpStatus.NOT_FOUND),
    BIKE_UNAVAILABLE(HttpStatus.CONFLICT),
    INSUFFICIENT_BALANCE(HttpStatus.PAYMENT_REQUIRED),
    RIDE_NOT_FOUND(HttpStatus.NOT_FOUND),
    RIDE_NOT_ACTIVE(HttpStatus.CONFLICT),
    INVALID_TIME_RANGE(HttpStatus.BAD_REQUEST),
    NO_PRICING_CONFIG(HttpStatus.NOT_FOUND),
    PRICING_PLAN_NOT_FOUND(HttpStatus.NOT_FOUND),
    PROMOTION_NOT_REDEEMABLE(HttpStatus.CONFLICT),
    RIDER_BUSY(HttpStatus.CONFLICT),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
