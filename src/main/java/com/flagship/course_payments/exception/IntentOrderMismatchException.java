package com.flagship.course_payments.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * The caller named an intent whose stored gateway order differs from the order it supplied.
 */
public class IntentOrderMismatchException extends CheckoutException {

    public IntentOrderMismatchException(UUID intentId, String suppliedOrderId) {
        super(HttpStatus.BAD_REQUEST, "Intent Order Mismatch",
                "Order " + suppliedOrderId + " does not belong to payment intent " + intentId);
    }
}
