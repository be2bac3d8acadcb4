package com.flagship.course_payments.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which webhook deliveries were processed, so a gateway redelivery is acknowledged
 * without running again.
 *
 * Strategy:
 * 1. Check Redis first when enabled
 * 2. Fall back to the processed_webhook_events table, which is authoritative
 * 3. Record in both after processing
 *
 * Settlement and payout transitions are idempotent on their own; this only saves the work.
 */
@Component
@Slf4j
public class WebhookDeliveryLog {

    private static final String REDIS_KEY_PREFIX = "webhook:event:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ProcessedWebhookEventRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Clock clock;

    public WebhookDeliveryLog(ProcessedWebhookEventRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              Clock clock,
                              @Value("${webhook.dedup.redis-enabled:true}") boolean redisEnabled) {
        this.repository = repository;
        this.redisTemplate = redisEnabled ? redisTemplate : Optional.empty();
        this.clock = clock;
    }

    public boolean isProcessed(String eventId) {
        if (redisTemplate.isPresent()) {
            try {
                if (Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + eventId))) {
                    log.debug("Webhook event found in Redis: eventId={}", eventId);
                    return true;
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for webhook event {}, falling back to database: {}",
                        eventId, e.getMessage());
            }
        }

        boolean processed = repository.existsById(eventId);
        if (processed) {
            cache(eventId);
        }
        return processed;
    }

    public void markProcessed(String eventId, String eventName, String outcome) {
        int inserted = repository.insertIfAbsent(eventId, eventName, outcome, clock.instant());
        if (inserted == 0) {
            log.info("Webhook event already recorded by a concurrent delivery: eventId={}", eventId);
        }
        cache(eventId);
    }

    private void cache(String eventId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + eventId, "1", REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache webhook event {} in Redis: {}", eventId, e.getMessage());
        }
    }
}
