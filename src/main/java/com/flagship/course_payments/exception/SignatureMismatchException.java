package com.flagship.course_payments.exception;

import org.springframework.http.HttpStatus;

public class SignatureMismatchException extends CheckoutException {

    public SignatureMismatchException(String reason) {
        super(HttpStatus.BAD_REQUEST, "Signature Mismatch", reason);
    }
}
