package com.flagship.course_payments.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Priced and display attributes of a product, frozen when the order is created.
 * Enrollment uses this copy, never the live catalog row.
 * Only the fields relevant to the product type are set.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProductSnapshot {
    String title;
    String description;
    UUID educatorId;

    // course, webinar, live class
    BigDecimal fees;
    BigDecimal discount;

    // test series
    BigDecimal price;
    Integer numberOfTests;

    // webinar, live class
    Instant timing;
}
