package com.flagship.course_payments.exception;

import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.UUID;

public class IntentExpiredException extends CheckoutException {

    public IntentExpiredException(UUID intentId, Instant expiredAt) {
        super(HttpStatus.CONFLICT, "Intent Expired",
                "Payment intent " + intentId + " expired at " + expiredAt);
    }
}
