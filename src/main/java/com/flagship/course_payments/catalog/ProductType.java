package com.flagship.course_payments.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.course_payments.exception.BusinessRuleViolationException;
import com.flagship.course_payments.exception.BusinessRuleViolationException.Rule;

/**
 * Kinds of product a student can be enrolled in. Wire names match the client apps.
 */
public enum ProductType {
    COURSE("course", true),
    TEST_SERIES("testSeries", true),
    WEBINAR("webinar", true),
    /**
     * Individual tests are only reachable through a test series.
     */
    TEST("test", false),
    LIVE_CLASS("liveClass", true);

    private final String wireName;
    private final boolean purchasable;

    ProductType(String wireName, boolean purchasable) {
        this.wireName = wireName;
        this.purchasable = purchasable;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isPurchasable() {
        return purchasable;
    }

    /**
     * Resolves a wire name to a type that can be bought on its own.
     *
     * @throws BusinessRuleViolationException for unknown or non-purchasable types
     */
    public static ProductType purchasableFrom(String wireName) {
        ProductType type = fromWireName(wireName);
        if (!type.purchasable) {
            throw new BusinessRuleViolationException(Rule.INVALID_PRODUCT_TYPE,
                    "Product type '" + wireName + "' cannot be purchased directly");
        }
        return type;
    }

    @JsonCreator
    public static ProductType fromWireName(String wireName) {
        for (ProductType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new BusinessRuleViolationException(Rule.INVALID_PRODUCT_TYPE,
                "Unknown product type: " + wireName);
    }
}
