package com.flagship.course_payments.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Paid access of one student to one product. Rows are written by
 * {@link EnrollmentRepository#insertIfAbsent}; the (student, type, product) unique constraint
 * decides which of two concurrent enrollments wins.
 */
@Entity
@Table(
    name = "enrollments",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_enrollments_student_product",
        columnNames = {"student_id", "product_type", "product_id"}),
    indexes = @Index(name = "idx_enrollments_product", columnList = "product_type, product_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Enrollment {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, updatable = false, length = 20)
    private ProductType productType;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "payment_intent_id", updatable = false)
    private UUID paymentIntentId;

    @Column(name = "snapshot", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String snapshot;

    @Column(name = "enrolled_at", nullable = false, updatable = false)
    private Instant enrolledAt;
}
