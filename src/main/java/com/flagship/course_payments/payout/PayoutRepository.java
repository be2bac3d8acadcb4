package com.flagship.course_payments.payout;

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
 * Payout transitions are conditional UPDATEs like payment intent settlement:
 * 1 row changed means this call applied the transition.
 */
@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, UUID>, JpaSpecificationExecutor<PayoutEntity> {

    Optional<PayoutEntity> findByPayoutCheckId(String payoutCheckId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PayoutEntity p
           SET p.status = :to,
               p.gatewayPayoutId = :gatewayPayoutId,
               p.failureReason = NULL,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status IN :from
        """)
    int markPaid(@Param("id") UUID id,
                 @Param("from") Collection<PayoutStatus> from,
                 @Param("to") PayoutStatus to,
                 @Param("gatewayPayoutId") String gatewayPayoutId,
                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PayoutEntity p
           SET p.status = :to,
               p.gatewayPayoutId = :gatewayPayoutId,
               p.failureReason = :failureReason,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status IN :from
        """)
    int markFailed(@Param("id") UUID id,
                   @Param("from") Collection<PayoutStatus> from,
                   @Param("to") PayoutStatus to,
                   @Param("gatewayPayoutId") String gatewayPayoutId,
                   @Param("failureReason") String failureReason,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PayoutEntity p
           SET p.status = :to,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status IN :from
        """)
    int markReversed(@Param("id") UUID id,
                     @Param("from") Collection<PayoutStatus> from,
                     @Param("to") PayoutStatus to,
                     @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PayoutEntity p
           SET p.status = :to,
               p.gatewayPayoutId = :gatewayPayoutId,
               p.narration = :narration,
               p.failureReason = NULL,
               p.initiationAttempts = p.initiationAttempts + 1,
               p.updatedAt = :now
         WHERE p.id = :id
           AND p.status IN :from
        """)
    int markProcessing(@Param("id") UUID id,
                       @Param("from") Collection<PayoutStatus> from,
                       @Param("to") PayoutStatus to,
                       @Param("gatewayPayoutId") String gatewayPayoutId,
                       @Param("narration") String narration,
                       @Param("now") Instant now);
}
