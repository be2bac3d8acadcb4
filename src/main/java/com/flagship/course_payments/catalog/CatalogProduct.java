package com.flagship.course_payments.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read model of a sellable product. The catalog owns these rows; this service only reads them.
 */
@Entity
@Table(
    name = "catalog_products",
    indexes = @Index(name = "idx_catalog_products_type", columnList = "product_type")
)
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CatalogProduct {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, length = 20)
    private ProductType type;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "educator_id")
    private UUID educatorId;

    @Column(precision = 12, scale = 2)
    private BigDecimal fees;

    @Column(name = "discount_percent", precision = 5, scale = 2)
    private BigDecimal discountPercent;

    @Column(precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "seat_limit")
    private Integer seatLimit;

    @Column(name = "number_of_tests")
    private Integer numberOfTests;

    @Column(name = "timing")
    private Instant timing;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private boolean completed;
}
