package com.flagship.course_payments.exception;

import org.springframework.http.HttpStatus;

/**
 * The payment gateway could not be reached or answered with an error.
 */
public class GatewayCommunicationException extends CheckoutException {

    public GatewayCommunicationException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "Gateway Communication Error", message, cause);
    }
}
