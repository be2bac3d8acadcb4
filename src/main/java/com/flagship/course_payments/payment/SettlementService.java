package com.flagship.course_payments.payment;

import com.flagship.course_payments.catalog.EnrollmentService;
import com.flagship.course_payments.exception.ResourceNotFoundException;
import com.flagship.course_payments.observability.CheckoutMetrics;
import com.flagship.course_payments.observability.CorrelationContext;
import com.flagship.course_payments.outbox.OutboxService;
import com.flagship.course_payments.payment.event.PaymentIntentFailedEvent;
import com.flagship.course_payments.payment.event.PaymentIntentSucceededEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Applies confirmations to payment intents.
 *
 * Key principles:
 * - every status change is one conditional UPDATE naming the states it may leave,
 *   so direct verification and webhooks can race freely
 * - only the call whose UPDATE changed a row runs side effects (enrollment, outbox event)
 * - the status write, enrollment and outbox event share one transaction; if enrollment
 *   fails the status write rolls back and the confirmation can be replayed
 * - nothing settles at or after expiresAt
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    static final String DEFAULT_FAILURE_REASON = "Payment failed";

    private final PaymentIntentRepository repository;
    private final PaymentIntentPersistenceService persistenceService;
    private final EnrollmentService enrollmentService;
    private final OutboxService outboxService;
    private final CheckoutMetrics checkoutMetrics;
    private final Clock clock;

    /**
     * Moves the intent to succeeded and enrolls the student, at most once per intent.
     *
     * @param signature stored for audit; null when the confirmation came from a webhook
     * @param channel "verify" or "webhook", for logs and metrics
     * @throws ResourceNotFoundException if the intent does not exist
     */
    @Transactional
    public SettlementResult settle(UUID intentId, String gatewayPaymentId, String signature,
                                   String lastEvent, String channel) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.INTENT_ID_MDC_KEY, intentId.toString());

        try {
            PaymentIntent current = load(intentId);
            if (current.getStatus() == PaymentIntentStatus.SUCCEEDED) {
                log.info("Intent already succeeded, nothing to do: event={}, channel={}", lastEvent, channel);
                return record(SettlementOutcome.ALREADY_SETTLED, current, channel);
            }

            Instant now = clock.instant();
            int updated = repository.settleIfLive(intentId, PaymentIntentStatus.SETTLEABLE,
                    PaymentIntentStatus.SUCCEEDED, paymentIdOrStored(gatewayPaymentId, current),
                    signature, lastEvent, now);

            if (updated == 1) {
                PaymentIntent settled = load(intentId);

                enrollmentService.enrollStudentInProduct(settled.getProductType(), settled.getProductId(),
                        settled.getStudentId(), settled.getId(), settled.getProductSnapshot());

                outboxService.saveEvent(PaymentIntentPersistenceService.AGGREGATE_TYPE, intentId,
                        PaymentIntentSucceededEvent.EVENT_TYPE,
                        PaymentIntentSucceededEvent.fromIntent(settled, channel));

                long duration = System.currentTimeMillis() - startTime;
                checkoutMetrics.recordSettlementDuration(Duration.ofMillis(duration));
                log.info("Payment intent settled: event={}, channel={}, amount={}, currency={}, duration={}ms",
                        lastEvent, channel, settled.getAmount(), settled.getCurrency(), duration);
                return record(SettlementOutcome.SETTLED, settled, channel);
            }

            PaymentIntent reloaded = load(intentId);
            if (reloaded.getStatus() == PaymentIntentStatus.SUCCEEDED) {
                log.info("Lost settlement race, intent already succeeded: event={}, channel={}", lastEvent, channel);
                return record(SettlementOutcome.ALREADY_SETTLED, reloaded, channel);
            }

            if (reloaded.isExpired(now) && !reloaded.isTerminal()) {
                String reason = "Payment confirmed after intent expired at " + reloaded.getExpiresAt();
                repository.recordLateConfirmation(intentId, PaymentIntentStatus.SETTLEABLE, lastEvent, reason, now);
                log.warn("Late success confirmation, intent not settled: event={}, channel={}, expiresAt={}",
                        lastEvent, channel, reloaded.getExpiresAt());
                return record(SettlementOutcome.EXPIRED, load(intentId), channel);
            }

            repository.recordLastEvent(intentId, lastEvent, now);
            log.warn("Success confirmation ignored: status={}, event={}, channel={}",
                    reloaded.getStatus(), lastEvent, channel);
            return record(SettlementOutcome.IGNORED, load(intentId), channel);

        } finally {
            MDC.remove(CorrelationContext.INTENT_ID_MDC_KEY);
        }
    }

    /**
     * pending → authorized. No side effects.
     */
    @Transactional
    public SettlementResult authorize(UUID intentId, String gatewayPaymentId, String lastEvent) {
        MDC.put(CorrelationContext.INTENT_ID_MDC_KEY, intentId.toString());
        try {
            PaymentIntent current = load(intentId);
            Instant now = clock.instant();

            int updated = repository.authorizeIfLive(intentId, PaymentIntentStatus.PENDING,
                    PaymentIntentStatus.AUTHORIZED, paymentIdOrStored(gatewayPaymentId, current), lastEvent, now);
            if (updated == 1) {
                log.info("Payment intent authorized: event={}", lastEvent);
                return record(SettlementOutcome.AUTHORIZED, load(intentId), "webhook");
            }

            repository.recordLastEvent(intentId, lastEvent, now);
            log.info("Authorization not applied: status={}, event={}", current.getStatus(), lastEvent);
            return record(SettlementOutcome.IGNORED, load(intentId), "webhook");

        } finally {
            MDC.remove(CorrelationContext.INTENT_ID_MDC_KEY);
        }
    }

    /**
     * {pending, authorized} → failed, with the gateway's error description as the reason.
     */
    @Transactional
    public SettlementResult fail(UUID intentId, String gatewayPaymentId, String errorReason, String lastEvent) {
        MDC.put(CorrelationContext.INTENT_ID_MDC_KEY, intentId.toString());
        try {
            PaymentIntent current = load(intentId);
            Instant now = clock.instant();
            String reason = errorReason != null && !errorReason.isBlank() ? errorReason : DEFAULT_FAILURE_REASON;

            int updated = repository.failIfOpen(intentId, PaymentIntentStatus.FAILABLE, PaymentIntentStatus.FAILED,
                    paymentIdOrStored(gatewayPaymentId, current), reason, lastEvent, now);
            if (updated == 1) {
                PaymentIntent failed = load(intentId);
                outboxService.saveEvent(PaymentIntentPersistenceService.AGGREGATE_TYPE, intentId,
                        PaymentIntentFailedEvent.EVENT_TYPE, PaymentIntentFailedEvent.fromIntent(failed));
                log.info("Payment intent failed: event={}, reason={}", lastEvent, reason);
                return record(SettlementOutcome.FAILED, failed, "webhook");
            }

            repository.recordLastEvent(intentId, lastEvent, now);
            log.info("Failure not applied: status={}, event={}", current.getStatus(), lastEvent);
            return record(SettlementOutcome.IGNORED, load(intentId), "webhook");

        } finally {
            MDC.remove(CorrelationContext.INTENT_ID_MDC_KEY);
        }
    }

    /**
     * Records an event that carries no transition.
     */
    @Transactional
    public SettlementResult recordEvent(UUID intentId, String lastEvent) {
        load(intentId);
        repository.recordLastEvent(intentId, lastEvent, clock.instant());
        log.info("Recorded event without transition: intentId={}, event={}", intentId, lastEvent);
        return record(SettlementOutcome.RECORDED, load(intentId), "webhook");
    }

    private PaymentIntent load(UUID intentId) {
        return persistenceService.findById(intentId)
                .orElseThrow(() -> new ResourceNotFoundException("payment intent", intentId));
    }

    private SettlementResult record(SettlementOutcome outcome, PaymentIntent intent, String channel) {
        checkoutMetrics.recordSettlement(outcome.wireName(), channel);
        return new SettlementResult(outcome, intent);
    }

    private static String paymentIdOrStored(String gatewayPaymentId, PaymentIntent current) {
        return gatewayPaymentId != null ? gatewayPaymentId : current.getGatewayPaymentId();
    }
}
