package com.flagship.course_payments.observability;

import java.util.UUID;

/**
 * Thread-local correlation id for the request being served.
 *
 * The id flows from the HTTP header (or is generated) into every log line via MDC,
 * and into outbox events so Kafka consumers can trace them back to the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String INTENT_ID_MDC_KEY = "intentId";
    public static final String PAYOUT_ID_MDC_KEY = "payoutId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readable logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
