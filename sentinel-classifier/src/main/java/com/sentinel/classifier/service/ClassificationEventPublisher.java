package com.sentinel.classifier.service;

import com.sentinel.classifier.config.ClassifierProperties;
import com.sentinel.classifier.dto.ClassifiedTransactionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes classified transactions to Kafka. Failures are logged and never reach the caller.
 */
@Slf4j
@Component
public class ClassificationEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final boolean enabled;

    @Value("${sentinel.kafka.topic.transaction-classified}")
    private String transactionClassifiedTopic;

    public ClassificationEventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                                        ClassifierProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.enabled = properties.getEvents().isEnabled();
    }

    public void publish(ClassifiedTransactionEvent event) {
        if (!enabled) {
            log.debug("Event publishing disabled, skipping transaction {}", event.getId());
            return;
        }

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(transactionClassifiedTopic, String.valueOf(event.getId()), event);
        } catch (RuntimeException e) {
            log.error("Failed to publish classification event for ID: {}", event.getId(), e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Published classification event to topic '{}', partition: {}, offset: {}",
                        transactionClassifiedTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish classification event for ID: {}", event.getId(), ex);
            }
        });
    }
}
