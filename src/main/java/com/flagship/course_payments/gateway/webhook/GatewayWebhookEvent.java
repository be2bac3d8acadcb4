package com.flagship.course_payments.gateway.webhook;

import java.util.Optional;
import java.util.UUID;

/**
 * A verified webhook delivery, classified once at the edge.
 *
 * Payment events carry the gateway order id and route to the settlement engine.
 * Payout events carry the payout reference id and route to payout reconciliation.
 * {@link Unrecognized} is neither and is rejected by the receiver.
 */
public sealed interface GatewayWebhookEvent {

    String eventName();

    /**
     * Event about a payment against one of our gateway orders.
     */
    sealed interface PaymentEvent extends GatewayWebhookEvent {

        String orderId();

        String paymentId();

        /**
         * Intent id echoed back from the order notes, when the gateway included them.
         */
        Optional<UUID> intentId();
    }

    /**
     * Event about an educator payout, keyed by the reference id we sent.
     */
    sealed interface PayoutEvent extends GatewayWebhookEvent {

        String referenceId();

        String gatewayPayoutId();
    }

    record PaymentAuthorized(String eventName, String orderId, String paymentId, Optional<UUID> intentId)
            implements PaymentEvent {
    }

    record PaymentSucceeded(String eventName, String orderId, String paymentId, Optional<UUID> intentId)
            implements PaymentEvent {
    }

    record PaymentFailed(String eventName, String orderId, String paymentId, Optional<UUID> intentId,
                         String errorDescription) implements PaymentEvent {
    }

    record UnrecognizedPaymentEvent(String eventName, String orderId, String paymentId, Optional<UUID> intentId)
            implements PaymentEvent {
    }

    record PayoutProcessed(String eventName, String referenceId, String gatewayPayoutId)
            implements PayoutEvent {
    }

    record PayoutFailed(String eventName, String referenceId, String gatewayPayoutId, String failureReason)
            implements PayoutEvent {
    }

    record PayoutReversed(String eventName, String referenceId, String gatewayPayoutId)
            implements PayoutEvent {
    }

    record UnrecognizedPayoutEvent(String eventName, String referenceId, String gatewayPayoutId)
            implements PayoutEvent {
    }

    record Unrecognized(String eventName) implements GatewayWebhookEvent {
    }
}
