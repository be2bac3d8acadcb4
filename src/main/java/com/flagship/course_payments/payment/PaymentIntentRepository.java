package com.flagship.course_payments.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for payment intents.
 *
 * Every status change is a single conditional UPDATE that names the states it may
 * leave. The returned row count tells the caller whether it won the transition:
 * 1 means this call moved the intent, 0 means another confirmation got there first
 * or the intent is no longer eligible.
 */
@Repository
public interface PaymentIntentRepository extends JpaRepository<PaymentIntentEntity, UUID>,
        JpaSpecificationExecutor<PaymentIntentEntity> {

    Optional<PaymentIntentEntity> findByGatewayOrderId(String gatewayOrderId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentIntentEntity p
           SET p.status = :to,
               p.gatewayPaymentId = :paymentId,
               p.gatewaySignature = :signature,
               p.lastEvent = :lastEvent,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status IN :from
           AND p.expiresAt > :now
        """)
    int settleIfLive(@Param("id") UUID id,
                     @Param("from") Collection<PaymentIntentStatus> from,
                     @Param("to") PaymentIntentStatus to,
                     @Param("paymentId") String paymentId,
                     @Param("signature") String signature,
                     @Param("lastEvent") String lastEvent,
                     @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentIntentEntity p
           SET p.status = :to,
               p.gatewayPaymentId = :paymentId,
               p.lastEvent = :lastEvent,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status = :from
           AND p.expiresAt > :now
        """)
    int authorizeIfLive(@Param("id") UUID id,
                        @Param("from") PaymentIntentStatus from,
                        @Param("to") PaymentIntentStatus to,
                        @Param("paymentId") String paymentId,
                        @Param("lastEvent") String lastEvent,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentIntentEntity p
           SET p.status = :to,
               p.gatewayPaymentId = :paymentId,
               p.errorReason = :errorReason,
               p.lastEvent = :lastEvent,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status IN :from
        """)
    int failIfOpen(@Param("id") UUID id,
                   @Param("from") Collection<PaymentIntentStatus> from,
                   @Param("to") PaymentIntentStatus to,
                   @Param("paymentId") String paymentId,
                   @Param("errorReason") String errorReason,
                   @Param("lastEvent") String lastEvent,
                   @Param("now") Instant now);

    /**
     * Records an event that does not move the status.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentIntentEntity p
           SET p.lastEvent = :lastEvent,
               p.updatedAt = :now
         WHERE p.id = :id
        """)
    int recordLastEvent(@Param("id") UUID id,
                        @Param("lastEvent") String lastEvent,
                        @Param("now") Instant now);

    /**
     * Records a success confirmation that arrived after the intent expired.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentIntentEntity p
           SET p.lastEvent = :lastEvent,
               p.errorReason = :errorReason,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status IN :from
        """)
    int recordLateConfirmation(@Param("id") UUID id,
                               @Param("from") Collection<PaymentIntentStatus> from,
                               @Param("lastEvent") String lastEvent,
                               @Param("errorReason") String errorReason,
                               @Param("now") Instant now);
}
