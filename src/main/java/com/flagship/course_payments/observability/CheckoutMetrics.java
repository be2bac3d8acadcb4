package com.flagship.course_payments.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for checkout, settlement and payout reconciliation.
 *
 * Metrics exposed:
 * - checkout.orders.created: orders opened at the gateway, by product type
 * - checkout.settlements: settlement attempts, by outcome and channel (verify / webhook)
 * - checkout.latency: operation latency
 * - checkout.signature.rejected: signature checks that failed, by channel
 * - payouts.transitions: payout reconciliation results, by target status and whether applied
 * - payouts.invoice.delivery: invoice sends, by result
 * - webhook.deliveries.duplicate: redelivered webhook events skipped
 */
@Component
public class CheckoutMetrics {

    private final MeterRegistry registry;
    private final Counter duplicateDeliveries;
    private final Timer settlementTimer;

    public CheckoutMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateDeliveries = Counter.builder("webhook.deliveries.duplicate")
                .description("Webhook deliveries skipped because the event id was already processed")
                .register(registry);

        this.settlementTimer = Timer.builder("checkout.settlement.duration")
                .description("Time taken to settle a payment intent")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordOrderCreated(String productType, String currency) {
        registry.counter("checkout.orders.created",
                "product_type", sanitizeTag(productType),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordSettlement(String outcome, String channel) {
        registry.counter("checkout.settlements",
                "outcome", sanitizeTag(outcome),
                "channel", sanitizeTag(channel)
        ).increment();
    }

    public void recordSettlementDuration(Duration duration) {
        settlementTimer.record(duration);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("checkout.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordSignatureRejected(String channel) {
        registry.counter("checkout.signature.rejected",
                "channel", sanitizeTag(channel)
        ).increment();
    }

    public void recordPayoutTransition(String targetStatus, boolean applied) {
        registry.counter("payouts.transitions",
                "status", sanitizeTag(targetStatus),
                "applied", String.valueOf(applied)
        ).increment();
    }

    public void recordInvoiceDelivery(boolean delivered) {
        registry.counter("payouts.invoice.delivery",
                "result", delivered ? "sent" : "failed"
        ).increment();
    }

    public void recordDuplicateDelivery() {
        duplicateDeliveries.increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
