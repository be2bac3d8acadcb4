package com.flagship.course_payments.payment;

import com.flagship.course_payments.catalog.ProductSnapshot;
import com.flagship.course_payments.catalog.ProductType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A single attempt by a student to buy a product.
 *
 * Key principles:
 * - amount and productSnapshot are fixed at creation
 * - status changes are applied by the settlement engine as conditional updates,
 *   this object only answers which transitions the graph allows
 * - intents are never deleted
 */
@Value
@Builder(toBuilder = true)
public class PaymentIntent {
    UUID id;
    UUID studentId;
    UUID productId;
    ProductType productType;
    /** Minor units. */
    long amount;
    CurrencyCode currency;
    PaymentIntentStatus status;
    String gatewayOrderId;
    String gatewayPaymentId;
    String gatewaySignature;
    String receipt;
    ProductSnapshot productSnapshot;
    Map<String, String> metadata;
    Instant expiresAt;
    String errorReason;
    String lastEvent;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new intent awaiting payment.
     */
    public static PaymentIntent pending(UUID studentId, ProductType productType, UUID productId,
                                        long amount, CurrencyCode currency, ProductSnapshot snapshot,
                                        Map<String, String> metadata, Instant expiresAt) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Payment intent amount must be positive");
        }
        return PaymentIntent.builder()
                .id(UUID.randomUUID())
                .studentId(studentId)
                .productType(productType)
                .productId(productId)
                .amount(amount)
                .currency(currency)
                .status(PaymentIntentStatus.PENDING)
                .productSnapshot(snapshot)
                .metadata(metadata)
                .expiresAt(expiresAt)
                .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * Checks if a transition from the current status to the target status is allowed.
     */
    public boolean canTransitionTo(PaymentIntentStatus target) {
        if (this.status == target) {
            return true; // idempotent
        }

        return switch (this.status) {
            case CREATED -> target == PaymentIntentStatus.PENDING;
            case PENDING -> target == PaymentIntentStatus.AUTHORIZED
                    || target == PaymentIntentStatus.SUCCEEDED
                    || target == PaymentIntentStatus.FAILED;
            case AUTHORIZED -> target == PaymentIntentStatus.SUCCEEDED || target == PaymentIntentStatus.FAILED;
            case SUCCEEDED, FAILED, REFUNDED, CANCELLED -> false; // terminal
        };
    }
}
