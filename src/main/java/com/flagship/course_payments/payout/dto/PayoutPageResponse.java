package com.flagship.course_payments.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.payout.Payout;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

@Value
@Builder
public class PayoutPageResponse {

    @JsonProperty("content")
    List<PayoutResponse> content;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("totalElements")
    long totalElements;

    @JsonProperty("totalPages")
    int totalPages;

    public static PayoutPageResponse from(Page<Payout> page) {
        return PayoutPageResponse.builder()
            .content(page.getContent().stream().map(PayoutResponse::from).toList())
            .page(page.getNumber())
            .size(page.getSize())
            .totalElements(page.getTotalElements())
            .totalPages(page.getTotalPages())
            .build();
    }
}
