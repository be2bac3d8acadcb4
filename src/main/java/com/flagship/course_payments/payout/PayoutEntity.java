package com.flagship.course_payments.payout;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of the payouts table. Status is only changed through the conditional
 * updates in {@link PayoutRepository}.
 */
@Entity
@Table(name = "payouts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PayoutEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "educator_id", nullable = false, updatable = false)
    private UUID educatorId;

    @Column(name = "gross_amount", nullable = false)
    private long grossAmount;

    @Column(name = "commission_amount", nullable = false)
    private long commissionAmount;

    @Column(nullable = false)
    private long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "gateway_payout_id")
    private String gatewayPayoutId;

    @Column(name = "scheduled_date", nullable = false)
    private LocalDate scheduledDate;

    @Column(name = "payout_check_id", nullable = false, unique = true, updatable = false)
    private String payoutCheckId;

    @Column(nullable = false)
    private int month;

    @Column(nullable = false)
    private int year;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column
    private String narration;

    @Column(name = "initiation_attempts", nullable = false)
    private int initiationAttempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public Payout toDomain() {
        return Payout.builder()
                .id(id)
                .educatorId(educatorId)
                .grossAmount(grossAmount)
                .commissionAmount(commissionAmount)
                .amount(amount)
                .currency(currency)
                .status(status)
                .gatewayPayoutId(gatewayPayoutId)
                .scheduledDate(scheduledDate)
                .payoutCheckId(payoutCheckId)
                .month(month)
                .year(year)
                .failureReason(failureReason)
                .narration(narration)
                .initiationAttempts(initiationAttempts)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
