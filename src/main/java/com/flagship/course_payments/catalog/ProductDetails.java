package com.flagship.course_payments.catalog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A purchasable product with its server-side price, in major units.
 */
@Value
@Builder
public class ProductDetails {
    UUID productId;
    ProductType type;
    String title;
    BigDecimal price;
    ProductSnapshot snapshot;
}
