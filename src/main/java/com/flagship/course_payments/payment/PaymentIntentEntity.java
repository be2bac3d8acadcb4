package com.flagship.course_payments.payment;

import com.flagship.course_payments.catalog.ProductType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payment intents.
 *
 * Key design principles:
 * - No setters: status only changes through the conditional updates in PaymentIntentRepository
 * - amount, currency and product_snapshot are updatable = false, so the price charged is the
 *   price quoted at creation
 * - Snapshot and metadata are JSONB text; PaymentIntentPersistenceService owns (de)serialization
 */
@Entity
@Table(
    name = "payment_intents",
    indexes = {
        @Index(name = "idx_payment_intents_gateway_order_id", columnList = "gateway_order_id"),
        @Index(name = "idx_payment_intents_student_product", columnList = "student_id, product_type, product_id"),
        @Index(name = "idx_payment_intents_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentIntentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, updatable = false, length = 20)
    private ProductType productType;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentIntentStatus status;

    @Column(name = "gateway_order_id", unique = true)
    private String gatewayOrderId;

    @Column(name = "gateway_payment_id")
    private String gatewayPaymentId;

    @Column(name = "gateway_signature")
    private String gatewaySignature;

    @Column(name = "receipt")
    private String receipt;

    @Column(name = "product_snapshot", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String productSnapshot;

    @Column(name = "metadata", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "error_reason", columnDefinition = "TEXT")
    private String errorReason;

    @Column(name = "last_event", length = 100)
    private String lastEvent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory: the only way to create an entity.
     */
    static PaymentIntentEntity fromDomain(PaymentIntent intent, String snapshotJson, String metadataJson,
                                          Instant createdAt) {
        return new PaymentIntentEntity(
            intent.getId(),
            intent.getStudentId(),
            intent.getProductId(),
            intent.getProductType(),
            intent.getAmount(),
            intent.getCurrency(),
            intent.getStatus(),
            intent.getGatewayOrderId(),
            intent.getGatewayPaymentId(),
            intent.getGatewaySignature(),
            intent.getReceipt(),
            snapshotJson,
            metadataJson,
            intent.getExpiresAt(),
            intent.getErrorReason(),
            intent.getLastEvent(),
            createdAt,
            null // updatedAt - set by @PrePersist
        );
    }

    /**
     * Attaches the gateway order created for this intent. Allowed once, while still pending.
     */
    void attachGatewayOrder(String gatewayOrderId, String receipt) {
        if (this.gatewayOrderId != null) {
            throw new IllegalStateException(
                "Payment intent " + this.id + " is already bound to gateway order " + this.gatewayOrderId);
        }
        if (this.status != PaymentIntentStatus.PENDING) {
            throw new IllegalStateException(
                "Cannot attach a gateway order to payment intent " + this.id + " in " + this.status + " status");
        }
        this.gatewayOrderId = gatewayOrderId;
        this.receipt = receipt;
    }
}
