package com.flagship.course_payments.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.catalog.ProductType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Totals per outcome. Amounts are minor units; totalTransactions counts intents in every status.
 */
@Value
@Builder
public class RevenueSummary {

    /** Inclusive, null when unbounded. */
    @JsonProperty("from")
    LocalDate from;

    /** Inclusive, null when unbounded. */
    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("productType")
    ProductType productType;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("totalRevenue")
    long totalRevenue;

    @JsonProperty("totalRefunded")
    long totalRefunded;

    @JsonProperty("totalFailed")
    long totalFailed;

    @JsonProperty("totalTransactions")
    long totalTransactions;
}
