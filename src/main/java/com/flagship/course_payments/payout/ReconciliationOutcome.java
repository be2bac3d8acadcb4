package com.flagship.course_payments.payout;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReconciliationOutcome {
    /** The webhook moved the payout. */
    APPLIED,
    /** The payout was already past the state the webhook names, e.g. a redelivered processed event. */
    UNCHANGED,
    /** No payout carries the webhook's reference id. */
    UNKNOWN_REFERENCE,
    /** A payout event with no transition attached. */
    IGNORED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
