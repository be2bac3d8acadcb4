package com.flagship.course_payments.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Razorpay credentials and client settings, bound from {@code gateway.razorpay.*}.
 */
@ConfigurationProperties(prefix = "gateway.razorpay")
@Getter
@Setter
public class GatewayProperties {

    /** Public key id, handed to the checkout client. */
    private String keyId;

    /** Signs direct payment verifications. */
    private String keySecret;

    /** Signs webhook deliveries. Blank means every webhook is rejected. */
    private String webhookSecret;

    private String baseUrl = "https://api.razorpay.com";

    /** RazorpayX account that funds educator payouts. */
    private String payoutAccountNumber;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);

    public boolean isConfigured() {
        return hasText(keyId) && hasText(keySecret);
    }

    public boolean isWebhookConfigured() {
        return hasText(webhookSecret);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
