package com.bikeshare.ride.service;

import com.bikeshare.shared.events.RideEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes ride events to Kafka, keyed by ride id so events of one ride stay ordered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotificationSink implements NotificationSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(String riderId, String eventType, RideEvent payload) {
        try {
            kafkaTemplate.send(eventType, payload.getRideId(), payload)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Delivery of {} for ride {} (rider {}) failed: {}",
                                    eventType, payload.getRideId(), riderId, ex.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Could not publish {} for ride {} (rider {}): {}",
                    eventType, payload.getRideId(), riderId, e.getMessage());
        }
    }
}
