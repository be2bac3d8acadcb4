package com.flagship.course_payments.payout;

import com.flagship.course_payments.exception.ResourceNotFoundException;
import com.flagship.course_payments.outbox.OutboxService;
import com.flagship.course_payments.payout.event.PayoutStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads payouts and applies their conditional transitions. Each applied transition
 * writes a PayoutStatusChanged outbox event in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutPersistenceService {

    static final String AGGREGATE_TYPE = "Payout";

    private final PayoutRepository repository;
    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<Payout> findById(UUID payoutId) {
        return repository.findById(payoutId).map(PayoutEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payout> findByPayoutCheckId(String payoutCheckId) {
        return repository.findByPayoutCheckId(payoutCheckId).map(PayoutEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Page<Payout> search(PayoutFilter filter, Pageable pageable) {
        return repository.findAll(filter.toSpecification(), pageable).map(PayoutEntity::toDomain);
    }

    /**
     * {pending, processing, failed} → paid.
     *
     * @return true if this call applied the transition
     */
    @Transactional
    public boolean markPaid(Payout current, String gatewayPayoutId, String cause) {
        int updated = repository.markPaid(current.getId(), PayoutStatus.PAYABLE, PayoutStatus.PAID,
                gatewayPayoutId != null ? gatewayPayoutId : current.getGatewayPayoutId(), clock.instant());
        return afterTransition(updated, current, cause);
    }

    /**
     * {pending, processing} → failed.
     */
    @Transactional
    public boolean markFailed(Payout current, String gatewayPayoutId, String failureReason, String cause) {
        int updated = repository.markFailed(current.getId(), PayoutStatus.FAILABLE, PayoutStatus.FAILED,
                gatewayPayoutId != null ? gatewayPayoutId : current.getGatewayPayoutId(),
                failureReason, clock.instant());
        return afterTransition(updated, current, cause);
    }

    /**
     * {pending, processing, paid} → reversed.
     */
    @Transactional
    public boolean markReversed(Payout current, String cause) {
        int updated = repository.markReversed(current.getId(), PayoutStatus.REVERSIBLE, PayoutStatus.REVERSED,
                clock.instant());
        return afterTransition(updated, current, cause);
    }

    /**
     * {pending, failed} → processing, once the gateway accepted the transfer.
     */
    @Transactional
    public boolean markProcessing(Payout current, String gatewayPayoutId, String narration, String cause) {
        int updated = repository.markProcessing(current.getId(), PayoutStatus.INITIABLE, PayoutStatus.PROCESSING,
                gatewayPayoutId, narration, clock.instant());
        return afterTransition(updated, current, cause);
    }

    private boolean afterTransition(int updated, Payout previous, String cause) {
        if (updated != 1) {
            return false;
        }

        Payout current = repository.findById(previous.getId())
                .map(PayoutEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("payout", previous.getId()));

        outboxService.saveEvent(AGGREGATE_TYPE, current.getId(), PayoutStatusChangedEvent.EVENT_TYPE,
                PayoutStatusChangedEvent.of(previous, current, cause));

        log.info("Payout transition applied: payoutCheckId={}, from={}, to={}, cause={}",
                current.getPayoutCheckId(), previous.getStatus(), current.getStatus(), cause);
        return true;
    }
}
