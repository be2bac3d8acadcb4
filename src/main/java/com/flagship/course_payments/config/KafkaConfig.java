package com.flagship.course_payments.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to.
 * Payment intent and payout events are keyed by aggregate id, so per-aggregate
 * ordering holds within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payment-intents:payment-intents}")
    private String paymentIntentsTopic;

    @Value("${kafka.topic.payouts:payouts}")
    private String payoutsTopic;

    @Bean
    public NewTopic paymentIntentsTopic() {
        return TopicBuilder.name(paymentIntentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic payoutsTopic() {
        return TopicBuilder.name(payoutsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
