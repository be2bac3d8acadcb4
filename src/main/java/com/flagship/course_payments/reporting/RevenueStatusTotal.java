package com.flagship.course_payments.reporting;

import com.flagship.course_payments.payment.PaymentIntentStatus;

/**
 * Intents in one status.
 *
 * @param totalAmount minor units
 */
public record RevenueStatusTotal(PaymentIntentStatus status, long count, long totalAmount) {
}
