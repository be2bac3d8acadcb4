package com.flagship.course_payments.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Base class for domain failures that map onto a fixed HTTP status.
 * GlobalExceptionHandler renders these as the standard error body.
 */
@Getter
public abstract class CheckoutException extends RuntimeException {

    private final HttpStatus status;
    private final String error;

    protected CheckoutException(HttpStatus status, String error, String message) {
        super(message);
        this.status = status;
        this.error = error;
    }

    protected CheckoutException(HttpStatus status, String error, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.error = error;
    }

    /**
     * Extra key/value pairs for the error body. Empty by default.
     */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
