package com.flagship.course_payments.reporting;

import com.flagship.course_payments.catalog.ProductType;
import com.flagship.course_payments.payment.CheckoutProperties;
import com.flagship.course_payments.payment.CurrencyCode;
import com.flagship.course_payments.payment.PaymentIntentFilter;
import com.flagship.course_payments.payment.PaymentIntentPersistenceService;
import com.flagship.course_payments.payment.PaymentIntentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Revenue readers over payment intents. Dates are UTC days, both ends inclusive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevenueReportService {

    static final int DEFAULT_MONTHS = 12;
    static final int MAX_MONTHS = 36;

    private final RevenueReportRepository repository;
    private final PaymentIntentPersistenceService paymentIntents;
    private final CheckoutProperties checkoutProperties;
    private final Clock clock;

    /**
     * Succeeded intents in the range, grouped by product type.
     */
    @Transactional(readOnly = true)
    public RevenueReport summarize(LocalDate from, LocalDate to) {
        requireOrdered(from, to);

        CurrencyCode currency = checkoutProperties.getCurrency();
        List<RevenueLine> lines = repository.summarize(PaymentIntentStatus.SUCCEEDED, currency,
                startOf(from), endOf(to));

        long totalCount = lines.stream().mapToLong(RevenueLine::count).sum();
        long totalAmount = lines.stream().mapToLong(RevenueLine::totalAmount).sum();
        log.debug("Revenue summarized: from={}, to={}, count={}, amount={}", from, to, totalCount, totalAmount);

        return RevenueReport.builder()
                .from(from)
                .to(to)
                .currency(currency.name())
                .totalCount(totalCount)
                .totalAmount(totalAmount)
                .byProductType(lines)
                .build();
    }

    /**
     * Succeeded, refunded and failed totals plus the number of intents in any status.
     * Either bound may be null for an open range.
     */
    @Transactional(readOnly = true)
    public RevenueSummary summary(LocalDate from, LocalDate to, ProductType productType) {
        requireOrdered(from, to);

        CurrencyCode currency = checkoutProperties.getCurrency();
        Instant start = from != null ? startOf(from) : Instant.EPOCH;
        Instant end = to != null ? endOf(to) : endOf(LocalDate.now(clock));
        List<RevenueStatusTotal> totals = repository.totalsByStatus(currency, start, end, productType);

        return RevenueSummary.builder()
                .from(from)
                .to(to)
                .productType(productType)
                .currency(currency.name())
                .totalRevenue(amountIn(totals, PaymentIntentStatus.SUCCEEDED))
                .totalRefunded(amountIn(totals, PaymentIntentStatus.REFUNDED))
                .totalFailed(amountIn(totals, PaymentIntentStatus.FAILED))
                .totalTransactions(totals.stream().mapToLong(RevenueStatusTotal::count).sum())
                .build();
    }

    /**
     * Succeeded revenue per calendar month for the last {@code months} months, current month
     * included. Months without revenue are omitted.
     */
    @Transactional(readOnly = true)
    public List<MonthlyRevenue> byMonth(Integer months, ProductType productType) {
        int window = months != null ? months : DEFAULT_MONTHS;
        if (window < 1 || window > MAX_MONTHS) {
            throw new IllegalArgumentException("months must be between 1 and " + MAX_MONTHS);
        }

        YearMonth current = YearMonth.now(clock);
        Instant start = startOf(current.minusMonths(window - 1L).atDay(1));
        Instant end = startOf(current.plusMonths(1).atDay(1));
        return repository.byMonth(PaymentIntentStatus.SUCCEEDED, checkoutProperties.getCurrency(),
                start, end, productType);
    }

    /**
     * Intents newest first. A null status lists succeeded intents; {@code all} lifts the filter.
     */
    @Transactional(readOnly = true)
    public RevenueTransactionPage transactions(TransactionQuery query, Pageable pageable) {
        requireOrdered(query.getFrom(), query.getTo());

        PaymentIntentFilter filter = PaymentIntentFilter.builder()
                .status(query.statusFilter())
                .productType(query.getProductType())
                .currency(checkoutProperties.getCurrency())
                .from(query.getFrom() != null ? startOf(query.getFrom()) : null)
                .to(query.getTo() != null ? endOf(query.getTo()) : null)
                .search(query.getSearch())
                .build();
        return RevenueTransactionPage.from(paymentIntents.search(filter, pageable));
    }

    private static long amountIn(List<RevenueStatusTotal> totals, PaymentIntentStatus status) {
        return totals.stream()
                .filter(total -> total.status() == status)
                .mapToLong(RevenueStatusTotal::totalAmount)
                .sum();
    }

    private static void requireOrdered(LocalDate from, LocalDate to) {
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
    }

    private static Instant startOf(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static Instant endOf(LocalDate day) {
        return startOf(day.plusDays(1));
    }
}
