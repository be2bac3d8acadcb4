package com.flagship.course_payments.payment;

import com.flagship.course_payments.crypto.SignatureVerification;
import com.flagship.course_payments.crypto.SignatureVerifier;
import com.flagship.course_payments.exception.IntentExpiredException;
import com.flagship.course_payments.exception.IntentOrderMismatchException;
import com.flagship.course_payments.exception.ResourceNotFoundException;
import com.flagship.course_payments.exception.SignatureMismatchException;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PaymentAuthorized;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PaymentEvent;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PaymentFailed;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PaymentSucceeded;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.UnrecognizedPaymentEvent;
import com.flagship.course_payments.observability.CheckoutMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for both confirmation channels. Resolves the intent and hands the
 * confirmation to {@link SettlementService}; the two channels may race on the same intent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentConfirmationService {

    static final String CHANNEL_VERIFY = "verify";
    static final String CHANNEL_WEBHOOK = "webhook";
    static final String CLIENT_VERIFY_EVENT = "client.verify";

    private final SignatureVerifier signatureVerifier;
    private final PaymentIntentPersistenceService persistenceService;
    private final SettlementService settlementService;
    private final CheckoutMetrics checkoutMetrics;

    /**
     * Direct verification from the client after checkout.
     *
     * @param intentId optional; when null the intent is looked up by gateway order id
     * @throws SignatureMismatchException if the signature does not match; nothing is written
     * @throws IntentOrderMismatchException if the intent belongs to a different order
     * @throws IntentExpiredException if the intent expired before the confirmation arrived
     */
    public SettlementResult verifyDirect(String orderId, String paymentId, String signature, UUID intentId) {
        SignatureVerification verification = signatureVerifier.verifyPaymentSignature(orderId, paymentId, signature);
        if (verification instanceof SignatureVerification.Rejected rejected) {
            checkoutMetrics.recordSignatureRejected(CHANNEL_VERIFY);
            log.warn("Direct verification rejected: orderId={}, reason={}", orderId, rejected.reason());
            throw new SignatureMismatchException(rejected.reason());
        }

        PaymentIntent intent = resolve(intentId, orderId);
        if (!orderId.equals(intent.getGatewayOrderId())) {
            throw new IntentOrderMismatchException(intent.getId(), orderId);
        }

        SettlementResult result = settlementService.settle(intent.getId(), paymentId, signature,
                CLIENT_VERIFY_EVENT, CHANNEL_VERIFY);

        if (result.outcome() == SettlementOutcome.EXPIRED) {
            throw new IntentExpiredException(intent.getId(), intent.getExpiresAt());
        }
        return result;
    }

    /**
     * Applies a verified payment webhook. The webhook signature covers the whole body,
     * so no per-payment signature is stored.
     */
    public SettlementResult handleWebhookPaymentEvent(PaymentEvent event) {
        PaymentIntent intent = resolveForWebhook(event);
        UUID id = intent.getId();

        if (event instanceof PaymentSucceeded succeeded) {
            return settlementService.settle(id, succeeded.paymentId(), null, succeeded.eventName(), CHANNEL_WEBHOOK);
        }
        if (event instanceof PaymentAuthorized authorized) {
            return settlementService.authorize(id, authorized.paymentId(), authorized.eventName());
        }
        if (event instanceof PaymentFailed failed) {
            return settlementService.fail(id, failed.paymentId(), failed.errorDescription(), failed.eventName());
        }
        if (event instanceof UnrecognizedPaymentEvent unrecognized) {
            return settlementService.recordEvent(id, unrecognized.eventName());
        }
        throw new IllegalStateException("Unhandled payment event " + event.getClass().getSimpleName());
    }

    /**
     * The gateway order id is authoritative. The intent id note is only a lookup shortcut and
     * is ignored when it names an intent of another order.
     */
    private PaymentIntent resolveForWebhook(PaymentEvent event) {
        String orderId = event.orderId();
        if (event.intentId().isPresent()) {
            UUID hinted = event.intentId().get();
            Optional<PaymentIntent> candidate = persistenceService.findById(hinted);
            if (candidate.isPresent() && orderId.equals(candidate.get().getGatewayOrderId())) {
                return candidate.get();
            }
            log.warn("Webhook intent note does not belong to the order, resolving by order id: "
                    + "intentId={}, orderId={}", hinted, orderId);
        }
        return persistenceService.findByGatewayOrderId(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("payment intent for order", orderId));
    }

    private PaymentIntent resolve(UUID intentId, String orderId) {
        if (intentId != null) {
            return persistenceService.findById(intentId)
                    .orElseThrow(() -> new ResourceNotFoundException("payment intent", intentId));
        }
        return persistenceService.findByGatewayOrderId(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("payment intent for order", orderId));
    }
}
