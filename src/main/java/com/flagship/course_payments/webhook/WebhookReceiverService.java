package com.flagship.course_payments.webhook;

import com.flagship.course_payments.crypto.SignatureVerification;
import com.flagship.course_payments.crypto.SignatureVerifier;
import com.flagship.course_payments.exception.SignatureMismatchException;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PaymentEvent;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PayoutEvent;
import com.flagship.course_payments.gateway.webhook.WebhookEventParser;
import com.flagship.course_payments.observability.CheckoutMetrics;
import com.flagship.course_payments.payment.PaymentConfirmationService;
import com.flagship.course_payments.payment.SettlementResult;
import com.flagship.course_payments.payout.PayoutReconciliationService;
import com.flagship.course_payments.payout.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Verifies, deduplicates and routes gateway webhooks.
 *
 * The signature is checked over the exact request bytes and those same bytes are parsed,
 * so nothing outside the signed body can influence processing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookReceiverService {

    static final String CHANNEL = "webhook";

    private final SignatureVerifier signatureVerifier;
    private final WebhookEventParser eventParser;
    private final WebhookDeliveryLog deliveryLog;
    private final PaymentConfirmationService confirmationService;
    private final PayoutReconciliationService reconciliationService;
    private final CheckoutMetrics checkoutMetrics;

    /**
     * @param eventId gateway delivery id, may be null
     * @throws SignatureMismatchException if the signature does not match the body
     * @throws IllegalArgumentException if the body is unreadable or names no order
     */
    public WebhookAck receive(byte[] rawBody, String signature, String eventId) {
        SignatureVerification verification = signatureVerifier.verifyWebhookSignature(rawBody, signature);
        if (verification instanceof SignatureVerification.Rejected rejected) {
            checkoutMetrics.recordSignatureRejected(CHANNEL);
            log.warn("Webhook rejected: eventId={}, reason={}", eventId, rejected.reason());
            throw new SignatureMismatchException(rejected.reason());
        }

        if (eventId != null && deliveryLog.isProcessed(eventId)) {
            checkoutMetrics.recordDuplicateDelivery();
            log.info("Duplicate webhook delivery acknowledged: eventId={}", eventId);
            return WebhookAck.duplicate();
        }

        GatewayWebhookEvent event = eventParser.parse(rawBody);
        log.info("Webhook received: event={}, eventId={}", event.eventName(), eventId);

        WebhookAck ack;
        if (event instanceof PaymentEvent paymentEvent) {
            ack = toAck(confirmationService.handleWebhookPaymentEvent(paymentEvent));
        } else if (event instanceof PayoutEvent payoutEvent) {
            ack = toAck(reconciliationService.reconcile(payoutEvent));
        } else {
            throw new IllegalArgumentException("order id missing");
        }

        if (eventId != null) {
            deliveryLog.markProcessed(eventId, event.eventName(), ack.getOutcome());
        }
        return ack;
    }

    private static WebhookAck toAck(SettlementResult result) {
        return WebhookAck.builder()
                .outcome(result.outcome().wireName())
                .status(result.intent().getStatus().wireName())
                .intentId(result.intent().getId())
                .build();
    }

    private static WebhookAck toAck(ReconciliationResult result) {
        WebhookAck.WebhookAckBuilder ack = WebhookAck.builder().outcome(result.outcome().wireName());
        if (result.payout() != null) {
            ack.status(result.payout().getStatus().wireName()).payoutId(result.payout().getId());
        }
        return ack.build();
    }
}
