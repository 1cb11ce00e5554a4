package com.bikeshare.ride.exception;

public class BikeShareException extends RuntimeException {

    private final ErrorCode code;

    public BikeShareException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
