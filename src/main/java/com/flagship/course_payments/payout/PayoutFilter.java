package com.flagship.course_payments.payout;

import jakarta.persistence.criteria.Predicate;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Optional filters for the payout listing. Null fields match everything.
 */
@Value
@Builder
public class PayoutFilter {
    UUID educatorId;
    PayoutStatus status;
    Integer month;
    Integer year;

    Specification<PayoutEntity> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (educatorId != null) {
                predicates.add(cb.equal(root.get("educatorId"), educatorId));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (month != null) {
                predicates.add(cb.equal(root.get("month"), month));
            }
            if (year != null) {
                predicates.add(cb.equal(root.get("year"), year));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
