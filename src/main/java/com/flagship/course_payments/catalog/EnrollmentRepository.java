package com.flagship.course_payments.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface EnrollmentRepository extends JpaRepository<Enrollment, UUID> {

    boolean existsByStudentIdAndProductTypeAndProductId(UUID studentId, ProductType productType, UUID productId);

    long countByProductTypeAndProductId(ProductType productType, UUID productId);

    /**
     * Runs inside the caller's transaction. A conflicting row leaves the transaction usable,
     * unlike a failed JPA insert.
     *
     * @return 1 if the enrollment was written, 0 if the student already had it
     */
    @Modifying
    @Query(value = """
        INSERT INTO enrollments (id, student_id, product_type, product_id, payment_intent_id, snapshot, enrolled_at)
        VALUES (:id, :studentId, :productType, :productId, :paymentIntentId, CAST(:snapshot AS jsonb), :enrolledAt)
        ON CONFLICT (student_id, product_type, product_id) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("studentId") UUID studentId,
                       @Param("productType") String productType,
                       @Param("productId") UUID productId,
                       @Param("paymentIntentId") UUID paymentIntentId,
                       @Param("snapshot") String snapshot,
                       @Param("enrolledAt") Instant enrolledAt);
}
