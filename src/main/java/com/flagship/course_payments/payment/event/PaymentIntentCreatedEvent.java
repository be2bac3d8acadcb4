package com.flagship.course_payments.payment.event;

import com.flagship.course_payments.payment.PaymentIntent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a student starts checkout and a pending intent is stored.
 */
@Value
public class PaymentIntentCreatedEvent implements PaymentIntentEvent {
    UUID eventId;
    UUID intentId;
    UUID studentId;
    String productType;
    UUID productId;
    long amount;
    String currency;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentIntentCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentIntentCreatedEvent fromIntent(PaymentIntent intent) {
        return new PaymentIntentCreatedEvent(
            UUID.randomUUID(),
            intent.getId(),
            intent.getStudentId(),
            intent.getProductType().getWireName(),
            intent.getProductId(),
            intent.getAmount(),
            intent.getCurrency().name(),
            intent.getExpiresAt(),
            Instant.now()
        );
    }
}
