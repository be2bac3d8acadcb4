package com.flagship.course_payments.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox.
 *
 * Written in the same transaction as the state change it describes and published to
 * Kafka afterwards by {@link OutboxPublisher}. If the business transaction rolls back,
 * so does the event.
 */
@Value
@Builder(toBuilder = true)
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "PaymentIntent" or "Payout"
    UUID aggregateId;
    String eventType;          // e.g. "PaymentIntentSucceeded"
    String payload;            // JSON
    String correlationId;      // request that caused the event, forwarded as a Kafka header
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    /**
     * Creates a new unpublished outbox event.
     */
    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId) {
        return OutboxEvent.builder()
            .id(UUID.randomUUID())
            .aggregateType(aggregateType)
            .aggregateId(aggregateId)
            .eventType(eventType)
            .payload(payload)
            .correlationId(correlationId)
            .createdAt(Instant.now())
            .build();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean hasExceededRetries(int maxRetries) {
        return retryCount >= maxRetries;
    }
}
