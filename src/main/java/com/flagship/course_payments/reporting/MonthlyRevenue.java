package com.flagship.course_payments.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Succeeded intents created in one UTC calendar month.
 *
 * @param revenue minor units
 */
public record MonthlyRevenue(@JsonProperty("year") int year,
                             @JsonProperty("month") int month,
                             @JsonProperty("count") long count,
                             @JsonProperty("revenue") long revenue) {
}
