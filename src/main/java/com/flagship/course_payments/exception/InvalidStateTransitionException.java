package com.flagship.course_payments.exception;

import org.springframework.http.HttpStatus;

/**
 * The requested operation is not allowed from the record's current status.
 */
public class InvalidStateTransitionException extends CheckoutException {

    public InvalidStateTransitionException(String resource, Object id, String currentStatus, String operation) {
        super(HttpStatus.CONFLICT, "Invalid State",
                "Cannot " + operation + " " + resource + " " + id + " in status " + currentStatus);
    }
}
