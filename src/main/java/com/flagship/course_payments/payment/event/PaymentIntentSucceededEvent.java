package com.flagship.course_payments.payment.event;

import com.flagship.course_payments.payment.PaymentIntent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published exactly once per intent, in the transaction that won the move to succeeded
 * and enrolled the student.
 */
@Value
public class PaymentIntentSucceededEvent implements PaymentIntentEvent {
    UUID eventId;
    UUID intentId;
    UUID studentId;
    String productType;
    UUID productId;
    long amount;
    String currency;
    String gatewayOrderId;
    String gatewayPaymentId;
    String confirmedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentIntentSucceeded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentIntentSucceededEvent fromIntent(PaymentIntent intent, String confirmedBy) {
        return new PaymentIntentSucceededEvent(
            UUID.randomUUID(),
            intent.getId(),
            intent.getStudentId(),
            intent.getProductType().getWireName(),
            intent.getProductId(),
            intent.getAmount(),
            intent.getCurrency().name(),
            intent.getGatewayOrderId(),
            intent.getGatewayPaymentId(),
            confirmedBy,
            Instant.now()
        );
    }
}
