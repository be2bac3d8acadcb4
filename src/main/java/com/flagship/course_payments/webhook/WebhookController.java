package com.flagship.course_payments.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway webhook endpoint. The body is taken as raw bytes so the signature is checked
 * against exactly what the gateway signed.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";
    static final String EVENT_ID_HEADER = "X-Razorpay-Event-Id";

    private final WebhookReceiverService receiverService;

    @PostMapping("/api/payments/webhook")
    public ResponseEntity<WebhookAck> receiveWebhook(
            @RequestBody byte[] rawBody,
            @RequestHeader(SIGNATURE_HEADER) String signature,
            @RequestHeader(value = EVENT_ID_HEADER, required = false) String eventId) {

        log.debug("Webhook delivery: bytes={}, eventId={}", rawBody.length, eventId);
        return ResponseEntity.ok(receiverService.receive(rawBody, signature, eventId));
    }
}
