package com.flagship.course_payments.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.catalog.ProductType;

/**
 * Succeeded intents of one product type.
 *
 * @param totalAmount minor units
 */
public record RevenueLine(@JsonProperty("productType") ProductType productType,
                          @JsonProperty("count") long count,
                          @JsonProperty("totalAmount") long totalAmount) {
}
