package com.flagship.course_payments.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A webhook delivery that was fully processed, keyed by the gateway's event id.
 * Rows are inserted with ON CONFLICT DO NOTHING by {@link ProcessedWebhookEventRepository}.
 */
@Entity
@Table(name = "processed_webhook_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedWebhookEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false, length = 100)
    private String eventId;

    @Column(name = "event_name", nullable = false, length = 100)
    private String eventName;

    @Column(nullable = false, length = 50)
    private String outcome;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;
}
