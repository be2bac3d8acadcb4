package com.flagship.course_payments.payment.event;

import com.flagship.course_payments.payment.PaymentIntent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentIntentFailedEvent implements PaymentIntentEvent {
    UUID eventId;
    UUID intentId;
    UUID studentId;
    String gatewayOrderId;
    String errorReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentIntentFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentIntentFailedEvent fromIntent(PaymentIntent intent) {
        return new PaymentIntentFailedEvent(
            UUID.randomUUID(),
            intent.getId(),
            intent.getStudentId(),
            intent.getGatewayOrderId(),
            intent.getErrorReason(),
            Instant.now()
        );
    }
}
