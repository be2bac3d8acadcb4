package com.flagship.course_payments.crypto;

import com.flagship.course_payments.gateway.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 checks for the two gateway confirmation channels.
 *
 * Direct verification signs "{orderId}|{paymentId}" with the key secret.
 * Webhooks sign the raw request body with the webhook secret. Both digests are
 * lowercase hex and compared in constant time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final GatewayProperties gatewayProperties;

    public SignatureVerification verifyPaymentSignature(String orderId, String paymentId, String signature) {
        if (isBlank(orderId) || isBlank(paymentId) || isBlank(signature)) {
            return SignatureVerification.rejected("orderId, paymentId and signature are required");
        }
        String secret = gatewayProperties.getKeySecret();
        if (isBlank(secret)) {
            log.error("Gateway key secret is not configured, rejecting payment signature");
            return SignatureVerification.rejected("payment signature cannot be verified");
        }

        byte[] payload = (orderId + "|" + paymentId).getBytes(StandardCharsets.UTF_8);
        return compare(hmacSha256Hex(secret, payload), signature, "payment signature mismatch");
    }

    /**
     * Verifies the webhook signature over exactly the bytes that will later be parsed.
     * A blank webhook secret rejects every delivery.
     */
    public SignatureVerification verifyWebhookSignature(byte[] rawBody, String signature) {
        if (isBlank(signature)) {
            return SignatureVerification.rejected("webhook signature header is missing");
        }
        String secret = gatewayProperties.getWebhookSecret();
        if (isBlank(secret)) {
            log.error("Webhook secret is not configured, rejecting webhook delivery");
            return SignatureVerification.rejected("webhook signature cannot be verified");
        }
        if (rawBody == null) {
            return SignatureVerification.rejected("webhook body is empty");
        }

        return compare(hmacSha256Hex(secret, rawBody), signature, "webhook signature mismatch");
    }

    public static String hmacSha256Hex(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 is unavailable", e);
        }
    }

    private SignatureVerification compare(String expected, String supplied, String rejection) {
        byte[] expectedBytes = expected.getBytes(StandardCharsets.US_ASCII);
        byte[] suppliedBytes = supplied.trim().getBytes(StandardCharsets.US_ASCII);
        if (MessageDigest.isEqual(expectedBytes, suppliedBytes)) {
            return SignatureVerification.verified();
        }
        return SignatureVerification.rejected(rejection);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
