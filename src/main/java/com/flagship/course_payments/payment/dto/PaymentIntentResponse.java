package com.flagship.course_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.catalog.ProductSnapshot;
import com.flagship.course_payments.catalog.ProductType;
import com.flagship.course_payments.payment.PaymentIntent;
import com.flagship.course_payments.payment.PaymentIntentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Full view of a payment intent. The stored signature is not exposed.
 */
@Value
@Builder
public class PaymentIntentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("studentId")
    UUID studentId;

    @JsonProperty("productId")
    UUID productId;

    @JsonProperty("productType")
    ProductType productType;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    PaymentIntentStatus status;

    @JsonProperty("gatewayOrderId")
    String gatewayOrderId;

    @JsonProperty("gatewayPaymentId")
    String gatewayPaymentId;

    @JsonProperty("receipt")
    String receipt;

    @JsonProperty("productSnapshot")
    ProductSnapshot productSnapshot;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("expiresAt")
    Instant expiresAt;

    @JsonProperty("errorReason")
    String errorReason;

    @JsonProperty("lastEvent")
    String lastEvent;

    @JsonProperty("createdAt")
    Instant createdAt;

    @JsonProperty("updatedAt")
    Instant updatedAt;

    public static PaymentIntentResponse from(PaymentIntent intent) {
        return PaymentIntentResponse.builder()
            .id(intent.getId())
            .studentId(intent.getStudentId())
            .productId(intent.getProductId())
            .productType(intent.getProductType())
            .amount(intent.getAmount())
            .currency(intent.getCurrency().name())
            .status(intent.getStatus())
            .gatewayOrderId(intent.getGatewayOrderId())
            .gatewayPaymentId(intent.getGatewayPaymentId())
            .receipt(intent.getReceipt())
            .productSnapshot(intent.getProductSnapshot())
            .metadata(intent.getMetadata())
            .expiresAt(intent.getExpiresAt())
            .errorReason(intent.getErrorReason())
            .lastEvent(intent.getLastEvent())
            .createdAt(intent.getCreatedAt())
            .updatedAt(intent.getUpdatedAt())
            .build();
    }
}
