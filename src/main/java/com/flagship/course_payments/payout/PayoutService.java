package com.flagship.course_payments.payout;

import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.catalog.StudentDirectory;
import com.flagship.course_payments.exception.BusinessRuleViolationException;
import com.flagship.course_payments.exception.BusinessRuleViolationException.Rule;
import com.flagship.course_payments.exception.InvalidStateTransitionException;
import com.flagship.course_payments.exception.ResourceNotFoundException;
import com.flagship.course_payments.gateway.GatewayPayout;
import com.flagship.course_payments.gateway.GatewayPayoutRequest;
import com.flagship.course_payments.gateway.PaymentGatewayClient;
import com.flagship.course_payments.observability.CheckoutMetrics;
import com.flagship.course_payments.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Requests educator payouts from the gateway and lists them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutService {

    static final String INITIATED_CAUSE = "payout.initiated";

    private final PayoutPersistenceService persistenceService;
    private final StudentDirectory studentDirectory;
    private final PaymentGatewayClient gatewayClient;
    private final CheckoutMetrics checkoutMetrics;

    /**
     * Sends a pending or failed payout to the educator's fund account and moves it to processing.
     * The payoutCheckId is the gateway reference id. The idempotency key is the payoutCheckId
     * plus the attempt number, so a retried request for the same attempt cannot pay twice and a
     * re-initiation after a failed payout is not deduplicated against the failed transfer.
     *
     * @throws ResourceNotFoundException if the payout or its educator does not exist
     * @throws InvalidStateTransitionException if the payout is not pending or failed
     * @throws BusinessRuleViolationException if the educator has no linked fund account
     * @throws com.flagship.course_payments.exception.GatewayCommunicationException if the gateway call fails
     */
    public Payout initiatePayout(UUID payoutId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PAYOUT_ID_MDC_KEY, payoutId.toString());

        try {
            Payout payout = persistenceService.findById(payoutId)
                    .orElseThrow(() -> new ResourceNotFoundException("payout", payoutId));

            if (!payout.canInitiate()) {
                throw new InvalidStateTransitionException("payout", payoutId, payout.getStatus().wireName(), "initiate");
            }

            Educator educator = studentDirectory.findEducator(payout.getEducatorId())
                    .orElseThrow(() -> new ResourceNotFoundException("educator", payout.getEducatorId()));
            if (!educator.hasFundAccount()) {
                throw new BusinessRuleViolationException(Rule.MISSING_FUND_ACCOUNT,
                        "Educator " + educator.getId() + " has no linked fund account");
            }

            String narration = "Payout for " + payout.getMonth() + "/" + payout.getYear();

            GatewayPayout gatewayPayout = gatewayClient.createPayout(GatewayPayoutRequest.builder()
                    .fundAccountId(educator.getFundAccountId())
                    .amount(payout.getAmount())
                    .currency(payout.getCurrency())
                    .referenceId(payout.getPayoutCheckId())
                    .narration(narration)
                    .idempotencyKey(payout.nextInitiationKey())
                    .build());

            boolean applied = persistenceService.markProcessing(payout, gatewayPayout.getId(), narration,
                    INITIATED_CAUSE);
            checkoutMetrics.recordPayoutTransition(PayoutStatus.PROCESSING.wireName(), applied);
            if (!applied) {
                log.warn("Payout changed state while initiating, keeping current state: gatewayPayoutId={}",
                        gatewayPayout.getId());
            }

            long duration = System.currentTimeMillis() - startTime;
            checkoutMetrics.recordLatency("initiate_payout", duration);
            log.info("Payout initiated: payoutCheckId={}, gatewayPayoutId={}, amount={}, duration={}ms",
                    payout.getPayoutCheckId(), gatewayPayout.getId(), payout.getAmount(), duration);

            return persistenceService.findById(payoutId)
                    .orElseThrow(() -> new ResourceNotFoundException("payout", payoutId));

        } finally {
            MDC.remove(CorrelationContext.PAYOUT_ID_MDC_KEY);
        }
    }

    /**
     * Newest first unless the pageable names another order.
     */
    public Page<Payout> listPayouts(PayoutFilter filter, Pageable pageable) {
        return persistenceService.search(filter, pageable);
    }
}
