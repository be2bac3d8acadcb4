package com.flagship.course_payments.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Facts about a payment intent, published through the outbox.
 */
public interface PaymentIntentEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getIntentId();

    Instant getOccurredAt();

    String getEventType();
}
