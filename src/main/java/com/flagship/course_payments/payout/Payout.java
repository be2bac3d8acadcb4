package com.flagship.course_payments.payout;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Monthly payout owed to an educator. Created by the monthly payout job; this service
 * only initiates the transfer and reconciles gateway notifications.
 *
 * Amounts are in minor units. amount = grossAmount - commissionAmount.
 */
@Value
@Builder(toBuilder = true)
public class Payout {
    UUID id;
    UUID educatorId;
    long grossAmount;
    long commissionAmount;
    long amount;
    String currency;
    PayoutStatus status;
    String gatewayPayoutId;
    LocalDate scheduledDate;
    /** Sent to the gateway as the payout reference id; payout webhooks are matched on it. */
    String payoutCheckId;
    int month;
    int year;
    String failureReason;
    String narration;
    /** Initiations the gateway accepted so far. */
    int initiationAttempts;
    Instant createdAt;
    Instant updatedAt;

    public boolean canInitiate() {
        return PayoutStatus.INITIABLE.contains(status);
    }

    /**
     * Idempotency key for the next gateway initiation. Stable until an initiation is accepted,
     * so a retried request is deduplicated, while a re-initiation after a failed payout gets a
     * fresh key.
     */
    public String nextInitiationKey() {
        return payoutCheckId + "-" + (initiationAttempts + 1);
    }
}
