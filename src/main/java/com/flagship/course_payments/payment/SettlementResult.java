package com.flagship.course_payments.payment;

/**
 * Outcome of a confirmation plus the intent as stored afterwards.
 */
public record SettlementResult(SettlementOutcome outcome, PaymentIntent intent) {
}
