package com.flagship.course_payments.payout;

import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.catalog.StudentDirectory;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PayoutEvent;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PayoutFailed;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PayoutProcessed;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.PayoutReversed;
import com.flagship.course_payments.gateway.webhook.GatewayWebhookEvent.UnrecognizedPayoutEvent;
import com.flagship.course_payments.observability.CheckoutMetrics;
import com.flagship.course_payments.observability.CorrelationContext;
import com.flagship.course_payments.payout.invoice.InvoiceDelivery;
import com.flagship.course_payments.payout.invoice.InvoiceGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Applies payout webhooks, matched to a payout by the reference id we sent (its payoutCheckId).
 *
 * Transitions commit before the invoice is sent. The invoice goes out only when this
 * call moved the payout to paid, so a redelivered processed event sends nothing.
 * Invoice failures are logged and counted; they never fail the webhook.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutReconciliationService {

    static final String DEFAULT_FAILURE_REASON = "Payout failed";

    private final PayoutPersistenceService persistenceService;
    private final StudentDirectory studentDirectory;
    private final InvoiceGenerator invoiceGenerator;
    private final InvoiceDelivery invoiceDelivery;
    private final CheckoutMetrics checkoutMetrics;

    public ReconciliationResult reconcile(PayoutEvent event) {
        Optional<Payout> found = persistenceService.findByPayoutCheckId(event.referenceId());
        if (found.isEmpty()) {
            log.warn("Payout webhook for unknown reference, acknowledging: event={}, referenceId={}",
                    event.eventName(), event.referenceId());
            return ReconciliationResult.unknownReference();
        }

        Payout payout = found.get();
        MDC.put(CorrelationContext.PAYOUT_ID_MDC_KEY, payout.getId().toString());
        try {
            if (event instanceof PayoutProcessed processed) {
                boolean applied = persistenceService.markPaid(payout, processed.gatewayPayoutId(), processed.eventName());
                checkoutMetrics.recordPayoutTransition(PayoutStatus.PAID.wireName(), applied);
                if (applied) {
                    sendInvoice(reload(payout));
                }
                return result(applied, payout);
            }
            if (event instanceof PayoutFailed failed) {
                String reason = failed.failureReason() != null && !failed.failureReason().isBlank()
                        ? failed.failureReason() : DEFAULT_FAILURE_REASON;
                boolean applied = persistenceService.markFailed(payout, failed.gatewayPayoutId(), reason,
                        failed.eventName());
                checkoutMetrics.recordPayoutTransition(PayoutStatus.FAILED.wireName(), applied);
                return result(applied, payout);
            }
            if (event instanceof PayoutReversed reversed) {
                boolean applied = persistenceService.markReversed(payout, reversed.eventName());
                checkoutMetrics.recordPayoutTransition(PayoutStatus.REVERSED.wireName(), applied);
                return result(applied, payout);
            }
            if (event instanceof UnrecognizedPayoutEvent unrecognized) {
                log.info("Payout event has no transition, ignoring: event={}, status={}",
                        unrecognized.eventName(), payout.getStatus());
                return new ReconciliationResult(ReconciliationOutcome.IGNORED, payout);
            }
            throw new IllegalStateException("Unhandled payout event " + event.getClass().getSimpleName());

        } finally {
            MDC.remove(CorrelationContext.PAYOUT_ID_MDC_KEY);
        }
    }

    private ReconciliationResult result(boolean applied, Payout before) {
        Payout after = reload(before);
        if (!applied) {
            log.info("Payout transition not applied, status={}", after.getStatus());
        }
        return new ReconciliationResult(applied ? ReconciliationOutcome.APPLIED : ReconciliationOutcome.UNCHANGED,
                after);
    }

    private Payout reload(Payout payout) {
        return persistenceService.findById(payout.getId()).orElse(payout);
    }

    private void sendInvoice(Payout payout) {
        Optional<Educator> educator = studentDirectory.findEducator(payout.getEducatorId());
        if (educator.isEmpty()) {
            log.warn("Cannot send payout invoice, educator not found: educatorId={}", payout.getEducatorId());
            checkoutMetrics.recordInvoiceDelivery(false);
            return;
        }

        try {
            byte[] invoice = invoiceGenerator.generateInvoice(payout, educator.get());
            invoiceDelivery.deliverInvoice(educator.get().getEmail(), payout, educator.get(), invoice);
            checkoutMetrics.recordInvoiceDelivery(true);
        } catch (RuntimeException e) {
            log.error("Payout invoice delivery failed: payoutCheckId={}, error={}",
                    payout.getPayoutCheckId(), e.getMessage(), e);
            checkoutMetrics.recordInvoiceDelivery(false);
        }
    }
}
