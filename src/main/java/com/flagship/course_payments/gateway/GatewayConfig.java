package com.flagship.course_payments.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Builds the gateway client explicitly so credentials are bound once at startup
 * and nothing holds a lazily created global client.
 */
@Configuration
@Slf4j
public class GatewayConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        return builder
                .rootUri(properties.getBaseUrl())
                .basicAuthentication(nullToEmpty(properties.getKeyId()), nullToEmpty(properties.getKeySecret()))
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }

    @Bean
    public PaymentGatewayClient paymentGatewayClient(RestTemplate gatewayRestTemplate, GatewayProperties properties) {
        if (!properties.isConfigured()) {
            log.warn("Gateway credentials are not configured; order creation will be rejected by the gateway");
        }
        if (!properties.isWebhookConfigured()) {
            log.warn("Webhook secret is not configured; every webhook delivery will be rejected");
        }
        return new RazorpayGatewayClient(gatewayRestTemplate, properties);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
