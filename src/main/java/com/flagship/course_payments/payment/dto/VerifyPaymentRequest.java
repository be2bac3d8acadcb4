package com.flagship.course_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Fields the checkout widget hands back after a successful payment.
 */
@Value
@Builder
@Jacksonized
public class VerifyPaymentRequest {

    @NotBlank(message = "Order ID is required")
    @JsonProperty("orderId")
    String orderId;

    @NotBlank(message = "Payment ID is required")
    @JsonProperty("paymentId")
    String paymentId;

    @NotBlank(message = "Signature is required")
    @JsonProperty("signature")
    String signature;

    @JsonProperty("intentId")
    UUID intentId;
}
