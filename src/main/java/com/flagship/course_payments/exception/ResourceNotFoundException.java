package com.flagship.course_payments.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ResourceNotFoundException extends CheckoutException {

    private final String resource;
    private final String identifier;

    public ResourceNotFoundException(String resource, Object identifier) {
        super(HttpStatus.NOT_FOUND, "Not Found", resource + " not found: " + identifier);
        this.resource = resource;
        this.identifier = String.valueOf(identifier);
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("resource", resource, "id", identifier);
    }
}
