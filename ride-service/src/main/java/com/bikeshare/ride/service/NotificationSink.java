package com.bikeshare.ride.service;

import com.bikeshare.shared.events.RideEvent;

/**
 * Fire-and-forget ride notifications. Implementations log their own failures
 * and never throw back into the ride lifecycle.
 */
public interface NotificationSink {

    /**
     * @param eventType one of the ride topics in {@code KafkaTopics}
     */
    void publish(String riderId, String eventType, RideEvent payload);
}
