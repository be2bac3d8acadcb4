package com.flagship.course_payments.payout;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of an educator payout.
 *
 * pending → processing → paid | failed, paid → reversed. A failed payout may be
 * initiated again, and a late processed webhook may still mark it paid.
 */
public enum PayoutStatus {
    PENDING,
    PROCESSING,
    PAID,
    FAILED,
    REVERSED;

    /** States a processed webhook may move to paid. */
    public static final Set<PayoutStatus> PAYABLE = EnumSet.of(PENDING, PROCESSING, FAILED);

    /** States a failed webhook may move to failed. */
    public static final Set<PayoutStatus> FAILABLE = EnumSet.of(PENDING, PROCESSING);

    /** States a reversed webhook may move to reversed. */
    public static final Set<PayoutStatus> REVERSIBLE = EnumSet.of(PENDING, PROCESSING, PAID);

    /** States from which a transfer can be requested. */
    public static final Set<PayoutStatus> INITIABLE = EnumSet.of(PENDING, FAILED);

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for an unknown status name
     */
    public static PayoutStatus fromWireName(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireName().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payout status: " + value));
    }
}
