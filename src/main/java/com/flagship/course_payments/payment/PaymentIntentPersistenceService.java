package com.flagship.course_payments.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.course_payments.catalog.ProductSnapshot;
import com.flagship.course_payments.exception.ResourceNotFoundException;
import com.flagship.course_payments.outbox.OutboxService;
import com.flagship.course_payments.payment.event.PaymentIntentCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the PaymentIntent domain object and PaymentIntentEntity, including the JSONB columns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentPersistenceService {

    static final String AGGREGATE_TYPE = "PaymentIntent";

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() { };

    private final PaymentIntentRepository repository;
    private final OutboxService outboxService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Inserts a new intent and its PaymentIntentCreated outbox event in one transaction.
     */
    @Transactional
    public PaymentIntent createPending(PaymentIntent intent) {
        PaymentIntentEntity entity = PaymentIntentEntity.fromDomain(intent,
                write(intent.getProductSnapshot()),
                write(intent.getMetadata()),
                clock.instant());
        PaymentIntent saved = toDomain(repository.save(entity));

        outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(),
                PaymentIntentCreatedEvent.EVENT_TYPE, PaymentIntentCreatedEvent.fromIntent(saved));

        log.debug("Saved payment intent {} for student {}", saved.getId(), saved.getStudentId());
        return saved;
    }

    @Transactional
    public PaymentIntent attachGatewayOrder(UUID intentId, String gatewayOrderId, String receipt) {
        PaymentIntentEntity entity = repository.findById(intentId)
                .orElseThrow(() -> new ResourceNotFoundException("payment intent", intentId));

        entity.attachGatewayOrder(gatewayOrderId, receipt);
        PaymentIntentEntity saved = repository.save(entity);

        log.debug("Attached gateway order {} to payment intent {}", gatewayOrderId, intentId);
        return toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentIntent> findById(UUID intentId) {
        return repository.findById(intentId).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentIntent> findByGatewayOrderId(String gatewayOrderId) {
        return repository.findByGatewayOrderId(gatewayOrderId).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public Page<PaymentIntent> search(PaymentIntentFilter filter, Pageable pageable) {
        return repository.findAll(filter.toSpecification(), pageable).map(this::toDomain);
    }

    PaymentIntent toDomain(PaymentIntentEntity entity) {
        return PaymentIntent.builder()
                .id(entity.getId())
                .studentId(entity.getStudentId())
                .productId(entity.getProductId())
                .productType(entity.getProductType())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .status(entity.getStatus())
                .gatewayOrderId(entity.getGatewayOrderId())
                .gatewayPaymentId(entity.getGatewayPaymentId())
                .gatewaySignature(entity.getGatewaySignature())
                .receipt(entity.getReceipt())
                .productSnapshot(read(entity.getProductSnapshot(), ProductSnapshot.class))
                .metadata(readMetadata(entity.getMetadata()))
                .expiresAt(entity.getExpiresAt())
                .errorReason(entity.getErrorReason())
                .lastEvent(entity.getLastEvent())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payment intent column", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payment intent JSON is unreadable", e);
        }
    }

    private Map<String, String> readMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payment intent metadata is unreadable", e);
        }
    }
}
