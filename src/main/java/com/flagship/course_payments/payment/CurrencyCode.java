package com.flagship.course_payments.payment;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currencies accepted at checkout (ISO-4217), with the minor-unit exponent the gateway expects.
 */
public enum CurrencyCode {
    INR(2), // Indian Rupee, amounts in paise
    USD(2); // US Dollar, amounts in cents

    private final int minorUnitDigits;

    CurrencyCode(int minorUnitDigits) {
        this.minorUnitDigits = minorUnitDigits;
    }

    /**
     * Converts a major-unit price to integer minor units, rounding half up.
     *
     * @throws ArithmeticException if the result does not fit in a long
     */
    public long toMinorUnits(BigDecimal majorUnits) {
        return majorUnits.movePointRight(minorUnitDigits)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    public BigDecimal toMajorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, minorUnitDigits);
    }
}
