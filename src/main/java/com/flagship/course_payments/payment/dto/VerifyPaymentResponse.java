package com.flagship.course_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.payment.PaymentIntentStatus;
import com.flagship.course_payments.payment.SettlementResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class VerifyPaymentResponse {

    @JsonProperty("status")
    PaymentIntentStatus status;

    @JsonProperty("intentId")
    UUID intentId;

    public static VerifyPaymentResponse from(SettlementResult result) {
        return VerifyPaymentResponse.builder()
            .status(result.intent().getStatus())
            .intentId(result.intent().getId())
            .build();
    }
}
