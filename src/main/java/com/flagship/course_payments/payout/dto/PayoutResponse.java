package com.flagship.course_payments.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.payout.Payout;
import com.flagship.course_payments.payout.PayoutStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PayoutResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("educatorId")
    UUID educatorId;

    @JsonProperty("grossAmount")
    long grossAmount;

    @JsonProperty("commissionAmount")
    long commissionAmount;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("gatewayPayoutId")
    String gatewayPayoutId;

    @JsonProperty("scheduledDate")
    LocalDate scheduledDate;

    @JsonProperty("payoutCheckId")
    String payoutCheckId;

    @JsonProperty("month")
    int month;

    @JsonProperty("year")
    int year;

    @JsonProperty("failureReason")
    String failureReason;

    @JsonProperty("narration")
    String narration;

    @JsonProperty("createdAt")
    Instant createdAt;

    @JsonProperty("updatedAt")
    Instant updatedAt;

    public static PayoutResponse from(Payout payout) {
        return PayoutResponse.builder()
            .id(payout.getId())
            .educatorId(payout.getEducatorId())
            .grossAmount(payout.getGrossAmount())
            .commissionAmount(payout.getCommissionAmount())
            .amount(payout.getAmount())
            .currency(payout.getCurrency())
            .status(payout.getStatus())
            .gatewayPayoutId(payout.getGatewayPayoutId())
            .scheduledDate(payout.getScheduledDate())
            .payoutCheckId(payout.getPayoutCheckId())
            .month(payout.getMonth())
            .year(payout.getYear())
            .failureReason(payout.getFailureReason())
            .narration(payout.getNarration())
            .createdAt(payout.getCreatedAt())
            .updatedAt(payout.getUpdatedAt())
            .build();
    }
}
