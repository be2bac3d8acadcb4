package com.flagship.course_payments.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Grants paid access. Idempotent per (student, product): a replay, or a second settlement
 * racing this one, finds the existing enrollment and does nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    private final EnrollmentRepository enrollmentRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Enrolls the student using the snapshot frozen on the payment intent.
     *
     * @return true if a new enrollment was written, false if the student already had access
     */
    @Transactional
    public boolean enrollStudentInProduct(ProductType productType, UUID productId, UUID studentId,
                                          UUID paymentIntentId, ProductSnapshot snapshot) {
        int inserted = enrollmentRepository.insertIfAbsent(UUID.randomUUID(), studentId, productType.name(),
                productId, paymentIntentId, serialize(snapshot), clock.instant());
        if (inserted == 0) {
            log.info("Student already enrolled, skipping: studentId={}, productType={}, productId={}",
                    studentId, productType.getWireName(), productId);
            return false;
        }

        log.info("Student enrolled: studentId={}, productType={}, productId={}, title={}",
                studentId, productType.getWireName(), productId, snapshot != null ? snapshot.getTitle() : null);
        return true;
    }

    private String serialize(ProductSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot != null ? snapshot : ProductSnapshot.builder().build());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize product snapshot", e);
        }
    }
}
