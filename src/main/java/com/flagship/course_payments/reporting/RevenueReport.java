package com.flagship.course_payments.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class RevenueReport {

    /** Inclusive. */
    @JsonProperty("from")
    LocalDate from;

    /** Inclusive. */
    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("totalCount")
    long totalCount;

    @JsonProperty("totalAmount")
    long totalAmount;

    @JsonProperty("byProductType")
    List<RevenueLine> byProductType;
}
