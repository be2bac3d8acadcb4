package com.flagship.course_payments.payment;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Checkout settings, bound from {@code checkout.*}.
 */
@ConfigurationProperties(prefix = "checkout")
@Getter
@Setter
public class CheckoutProperties {

    /** How long a student has to complete payment before the intent can no longer settle. */
    private Duration intentTtl = Duration.ofMinutes(20);

    private CurrencyCode currency = CurrencyCode.INR;

    private String receiptPrefix = "rcpt_";
}
