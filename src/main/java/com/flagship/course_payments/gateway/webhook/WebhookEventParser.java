package com.flagship.course_payments.gateway.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns the verified webhook bytes into a {@link GatewayWebhookEvent}.
 *
 * Callers must pass the same byte array that was signature-checked; no other
 * representation of the request body is consulted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookEventParser {

    private static final String PAYOUT_PREFIX = "payout.";
    private static final String INTENT_NOTE = "paymentIntentId";

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    public GatewayWebhookEvent parse(byte[] verifiedBody) {
        JsonNode root = readTree(verifiedBody);
        String eventName = text(root.path("event"));
        JsonNode payload = root.path("payload");

        if (eventName != null && eventName.startsWith(PAYOUT_PREFIX)) {
            return parsePayoutEvent(eventName, payload.path("payout").path("entity"));
        }

        JsonNode paymentEntity = payload.path("payment").path("entity");
        JsonNode orderEntity = payload.path("order").path("entity");

        String orderId = firstNonBlank(text(paymentEntity.path("order_id")), text(orderEntity.path("id")));
        if (orderId == null) {
            return new GatewayWebhookEvent.Unrecognized(eventName);
        }

        String paymentId = text(paymentEntity.path("id"));
        String paymentStatus = text(paymentEntity.path("status"));
        // Payment notes come from the checkout options and are client-controlled; only the
        // order's notes are written by this service.
        Optional<UUID> intentId = intentIdFromNotes(orderEntity.path("notes"));

        if ("payment.captured".equals(eventName) || "order.paid".equals(eventName)
                || "captured".equals(paymentStatus)) {
            return new GatewayWebhookEvent.PaymentSucceeded(eventName, orderId, paymentId, intentId);
        }
        if ("payment.failed".equals(eventName) || "failed".equals(paymentStatus)) {
            String description = text(paymentEntity.path("error_description"));
            return new GatewayWebhookEvent.PaymentFailed(eventName, orderId, paymentId, intentId,
                    description != null ? description : "Payment failed");
        }
        if ("payment.authorized".equals(eventName)) {
            return new GatewayWebhookEvent.PaymentAuthorized(eventName, orderId, paymentId, intentId);
        }
        return new GatewayWebhookEvent.UnrecognizedPaymentEvent(eventName, orderId, paymentId, intentId);
    }

    private GatewayWebhookEvent parsePayoutEvent(String eventName, JsonNode payoutEntity) {
        String referenceId = text(payoutEntity.path("reference_id"));
        String gatewayPayoutId = text(payoutEntity.path("id"));

        switch (eventName) {
            case "payout.processed":
                return new GatewayWebhookEvent.PayoutProcessed(eventName, referenceId, gatewayPayoutId);
            case "payout.failed":
                String reason = firstNonBlank(
                        text(payoutEntity.path("status_details").path("description")),
                        text(payoutEntity.path("failure_reason")));
                return new GatewayWebhookEvent.PayoutFailed(eventName, referenceId, gatewayPayoutId,
                        reason != null ? reason : "Payout failed");
            case "payout.reversed":
                return new GatewayWebhookEvent.PayoutReversed(eventName, referenceId, gatewayPayoutId);
            default:
                return new GatewayWebhookEvent.UnrecognizedPayoutEvent(eventName, referenceId, gatewayPayoutId);
        }
    }

    private JsonNode readTree(byte[] body) {
        if (body == null || body.length == 0) {
            throw new IllegalArgumentException("Webhook body is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Webhook body is not a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }
    }

    private Optional<UUID> intentIdFromNotes(JsonNode notes) {
        String value = text(notes.path(INTENT_NOTE));
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed paymentIntentId note: {}", value);
            return Optional.empty();
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static String firstNonBlank(String first, String second) {
        return first != null ? first : second;
    }
}
