package com.flagship.course_payments.payment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a payment intent.
 *
 * created → pending → authorized → succeeded | failed, with pending → succeeded | failed
 * as shortcuts. Status only ever moves forward along these edges.
 */
public enum PaymentIntentStatus {
    CREATED,
    /**
     * Gateway order exists, waiting for the student to pay.
     */
    PENDING,
    /**
     * Gateway authorized the payment but has not captured it yet.
     */
    AUTHORIZED,
    SUCCEEDED,
    FAILED,
    /**
     * Set by admin tooling outside this service.
     */
    REFUNDED,
    /**
     * Set by admin tooling outside this service.
     */
    CANCELLED;

    /**
     * States a success confirmation may settle from.
     */
    public static final Set<PaymentIntentStatus> SETTLEABLE = EnumSet.of(PENDING, AUTHORIZED);

    /**
     * States a failure notification may fail from.
     */
    public static final Set<PaymentIntentStatus> FAILABLE = EnumSet.of(PENDING, AUTHORIZED);

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == REFUNDED || this == CANCELLED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PaymentIntentStatus fromWireName(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireName().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment intent status: " + value));
    }
}
