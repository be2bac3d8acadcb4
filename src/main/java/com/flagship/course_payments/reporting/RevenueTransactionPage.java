package com.flagship.course_payments.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.payment.PaymentIntent;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

@Value
@Builder
public class RevenueTransactionPage {

    @JsonProperty("content")
    List<RevenueTransaction> content;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("totalElements")
    long totalElements;

    @JsonProperty("totalPages")
    int totalPages;

    static RevenueTransactionPage from(Page<PaymentIntent> page) {
        return RevenueTransactionPage.builder()
            .content(page.getContent().stream().map(RevenueTransaction::from).toList())
            .page(page.getNumber())
            .size(page.getSize())
            .totalElements(page.getTotalElements())
            .totalPages(page.getTotalPages())
            .build();
    }
}
