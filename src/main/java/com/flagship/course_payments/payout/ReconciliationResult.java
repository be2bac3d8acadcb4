package com.flagship.course_payments.payout;

/**
 * @param payout the payout after reconciliation; null for an unknown reference
 */
public record ReconciliationResult(ReconciliationOutcome outcome, Payout payout) {

    static ReconciliationResult unknownReference() {
        return new ReconciliationResult(ReconciliationOutcome.UNKNOWN_REFERENCE, null);
    }
}
