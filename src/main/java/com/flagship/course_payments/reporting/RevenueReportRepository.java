package com.flagship.course_payments.reporting;

import com.flagship.course_payments.catalog.ProductType;
import com.flagship.course_payments.payment.CurrencyCode;
import com.flagship.course_payments.payment.PaymentIntentEntity;
import com.flagship.course_payments.payment.PaymentIntentStatus;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only aggregates over payment intents.
 */
public interface RevenueReportRepository extends Repository<PaymentIntentEntity, UUID> {

    @Query("""
        SELECT new com.flagship.course_payments.reporting.RevenueLine(p.productType, COUNT(p), SUM(p.amount))
          FROM PaymentIntentEntity p
         WHERE p.status = :status
           AND p.currency = :currency
           AND p.createdAt >= :from
           AND p.createdAt < :to
         GROUP BY p.productType
         ORDER BY p.productType
        """)
    List<RevenueLine> summarize(@Param("status") PaymentIntentStatus status,
                                @Param("currency") CurrencyCode currency,
                                @Param("from") Instant from,
                                @Param("to") Instant to);

    @Query("""
        SELECT new com.flagship.course_payments.reporting.RevenueStatusTotal(p.status, COUNT(p), SUM(p.amount))
          FROM PaymentIntentEntity p
         WHERE p.currency = :currency
           AND p.createdAt >= :from
           AND p.createdAt < :to
           AND (:productType IS NULL OR p.productType = :productType)
         GROUP BY p.status
        """)
    List<RevenueStatusTotal> totalsByStatus(@Param("currency") CurrencyCode currency,
                                            @Param("from") Instant from,
                                            @Param("to") Instant to,
                                            @Param("productType") ProductType productType);

    @Query("""
        SELECT new com.flagship.course_payments.reporting.MonthlyRevenue(
                   YEAR(p.createdAt), MONTH(p.createdAt), COUNT(p), SUM(p.amount))
          FROM PaymentIntentEntity p
         WHERE p.status = :status
           AND p.currency = :currency
           AND p.createdAt >= :from
           AND p.createdAt < :to
           AND (:productType IS NULL OR p.productType = :productType)
         GROUP BY YEAR(p.createdAt), MONTH(p.createdAt)
         ORDER BY YEAR(p.createdAt), MONTH(p.createdAt)
        """)
    List<MonthlyRevenue> byMonth(@Param("status") PaymentIntentStatus status,
                                 @Param("currency") CurrencyCode currency,
                                 @Param("from") Instant from,
                                 @Param("to") Instant to,
                                 @Param("productType") ProductType productType);
}
