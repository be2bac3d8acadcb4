package com.flagship.course_payments.payment;

import com.flagship.course_payments.catalog.ProductType;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Optional filters for the transaction listing. Null fields match everything.
 *
 * {@code search} is a case-insensitive substring match over student name and email, product
 * title, receipt, gateway payment id and gateway order id.
 */
@Value
@Builder
public class PaymentIntentFilter {
    PaymentIntentStatus status;
    ProductType productType;
    CurrencyCode currency;
    /** Inclusive. */
    Instant from;
    /** Exclusive. */
    Instant to;
    String search;

    Specification<PaymentIntentEntity> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (productType != null) {
                predicates.add(cb.equal(root.get("productType"), productType));
            }
            if (currency != null) {
                predicates.add(cb.equal(root.get("currency"), currency));
            }
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), to));
            }
            if (search != null && !search.isBlank()) {
                predicates.add(searchPredicate(root, cb, likePattern(search)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static Predicate searchPredicate(Root<PaymentIntentEntity> root, CriteriaBuilder cb, String pattern) {
        List<Expression<String>> fields = List.of(
                jsonText(root, cb, "metadata", "studentName"),
                jsonText(root, cb, "metadata", "studentEmail"),
                jsonText(root, cb, "productSnapshot", "title"),
                root.get("receipt"),
                root.get("gatewayPaymentId"),
                root.get("gatewayOrderId"));
        return cb.or(fields.stream()
                .map(field -> cb.like(cb.lower(field), pattern, '\\'))
                .toArray(Predicate[]::new));
    }

    private static Expression<String> jsonText(Root<PaymentIntentEntity> root, CriteriaBuilder cb,
                                               String column, String key) {
        return cb.function("jsonb_extract_path_text", String.class, root.get(column), cb.literal(key));
    }

    static String likePattern(String search) {
        String escaped = search.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
