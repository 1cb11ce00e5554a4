package com.bikeshare.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String RIDE_STARTED   = "ride.started";
    public static final String RIDE_COMPLETED = "ride.completed";
    public static final String RIDE_CANCELLED = "ride.cancelled";
}
