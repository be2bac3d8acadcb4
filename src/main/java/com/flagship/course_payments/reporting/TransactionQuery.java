package com.flagship.course_payments.reporting;

import com.flagship.course_payments.catalog.ProductType;
import com.flagship.course_payments.payment.PaymentIntentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filters for the transaction listing as received from the caller.
 */
@Value
@Builder
public class TransactionQuery {

    static final String ALL_STATUSES = "all";

    /** Wire name, {@code all}, or null for succeeded only. */
    String status;
    ProductType productType;
    LocalDate from;
    LocalDate to;
    String search;

    PaymentIntentStatus statusFilter() {
        if (status == null || status.isBlank()) {
            return PaymentIntentStatus.SUCCEEDED;
        }
        if (ALL_STATUSES.equalsIgnoreCase(status)) {
            return null;
        }
        return PaymentIntentStatus.fromWireName(status);
    }
}
