package com.flagship.course_payments.payment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a confirmation did to its intent.
 */
public enum SettlementOutcome {
    /** This call moved the intent to succeeded and enrolled the student. */
    SETTLED,
    /** Another confirmation settled the intent first. Nothing changed. */
    ALREADY_SETTLED,
    /** Success arrived after expiresAt. Recorded on the intent, status unchanged. */
    EXPIRED,
    /** Intent is in a state the event cannot move. lastEvent recorded. */
    IGNORED,
    AUTHORIZED,
    FAILED,
    /** Unrecognized event on a known intent. lastEvent recorded. */
    RECORDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
