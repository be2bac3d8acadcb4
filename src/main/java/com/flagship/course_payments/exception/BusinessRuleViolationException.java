package com.flagship.course_payments.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * A purchase or payout request that is well formed but not allowed.
 * Always raised before any state is written.
 */
@Getter
public class BusinessRuleViolationException extends CheckoutException {

    public enum Rule {
        ALREADY_ENROLLED,
        CAPACITY_EXCEEDED,
        INACTIVE_ENTITY,
        INVALID_PRICE,
        INVALID_PRODUCT_TYPE,
        MISSING_FUND_ACCOUNT
    }

    private final Rule rule;

    public BusinessRuleViolationException(Rule rule, String message) {
        super(HttpStatus.BAD_REQUEST, "Business Rule Violation", message);
        this.rule = rule;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("rule", rule.name());
    }
}
