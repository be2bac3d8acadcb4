package com.flagship.course_payments.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.catalog.ProductType;
import com.flagship.course_payments.payment.PaymentIntent;
import com.flagship.course_payments.payment.PaymentIntentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class RevenueTransaction {

    static final String UNKNOWN_STUDENT = "Unknown";
    static final String UNTITLED_PRODUCT = "Untitled";

    @JsonProperty("id")
    UUID id;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("studentName")
    String studentName;

    @JsonProperty("studentEmail")
    String studentEmail;

    @JsonProperty("productTitle")
    String productTitle;

    @JsonProperty("productType")
    ProductType productType;

    /** Minor units. */
    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    PaymentIntentStatus status;

    @JsonProperty("paymentId")
    String paymentId;

    @JsonProperty("orderId")
    String orderId;

    @JsonProperty("receipt")
    String receipt;

    static RevenueTransaction from(PaymentIntent intent) {
        Map<String, String> metadata = intent.getMetadata() != null ? intent.getMetadata() : Map.of();
        String title = intent.getProductSnapshot() != null ? intent.getProductSnapshot().getTitle() : null;
        return RevenueTransaction.builder()
                .id(intent.getId())
                .date(intent.getCreatedAt())
                .studentName(metadata.getOrDefault("studentName", UNKNOWN_STUDENT))
                .studentEmail(metadata.getOrDefault("studentEmail", ""))
                .productTitle(title != null ? title : UNTITLED_PRODUCT)
                .productType(intent.getProductType())
                .amount(intent.getAmount())
                .currency(intent.getCurrency().name())
                .status(intent.getStatus())
                .paymentId(nullToEmpty(intent.getGatewayPaymentId()))
                .orderId(nullToEmpty(intent.getGatewayOrderId()))
                .receipt(nullToEmpty(intent.getReceipt()))
                .build();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
