package com.flagship.course_payments.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ProcessedWebhookEventRepository extends JpaRepository<ProcessedWebhookEventEntity, String> {

    /**
     * @return 1 if the delivery was recorded, 0 if another request recorded it first
     */
    @Transactional
    @Modifying
    @Query(value = """
        INSERT INTO processed_webhook_events (event_id, event_name, outcome, processed_at)
        VALUES (:eventId, :eventName, :outcome, :processedAt)
        ON CONFLICT (event_id) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("eventId") String eventId,
                       @Param("eventName") String eventName,
                       @Param("outcome") String outcome,
                       @Param("processedAt") Instant processedAt);
}
