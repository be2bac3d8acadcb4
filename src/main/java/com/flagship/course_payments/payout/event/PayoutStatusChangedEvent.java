package com.flagship.course_payments.payout.event;

import com.flagship.course_payments.payout.Payout;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Written to the outbox whenever a payout transition is applied.
 */
@Value
public class PayoutStatusChangedEvent {
    UUID eventId;
    UUID payoutId;
    UUID educatorId;
    String payoutCheckId;
    String previousStatus;
    String status;
    long amount;
    String currency;
    String gatewayPayoutId;
    String failureReason;
    String cause;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutStatusChanged";

    public static PayoutStatusChangedEvent of(Payout previous, Payout current, String cause) {
        return new PayoutStatusChangedEvent(
            UUID.randomUUID(),
            current.getId(),
            current.getEducatorId(),
            current.getPayoutCheckId(),
            previous.getStatus().wireName(),
            current.getStatus().wireName(),
            current.getAmount(),
            current.getCurrency(),
            current.getGatewayPayoutId(),
            current.getFailureReason(),
            cause,
            Instant.now()
        );
    }
}
