package com.sentinel.classifier.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.classifier.dto.ClassificationResponse;
import com.sentinel.classifier.dto.ClassifyTransactionRequest;
import com.sentinel.classifier.service.ClassificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.annotation.RetryableTopic;
import org.springframework.kafka.retrytopic.DltStrategy;
import org.springframework.retry.annotation.Backoff;
import org.springframework.stereotype.Component;

/**
 * Classifies descriptions arriving on Kafka instead of over HTTP.
 *
 * Expected message format:
 * {
 *   "text": "Starbucks Coffee",
 *   "amount": 4.85
 * }
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClassificationRequestListener {

    private final ClassificationService classificationService;
    private final ObjectMapper objectMapper;

    /**
     * @RetryableTopic:
     * 1. If this fails, wait 1 second, retry.
     * 2. If it fails again, wait 2 seconds, retry.
     * 3. If it fails 3 times, send to "classification.requests-dlt" (Dead Letter Topic).
     */
    @RetryableTopic(
        attempts = "3",
        backoff = @Backoff(delay = 1000, multiplier = 2.0),
        dltStrategy = DltStrategy.FAIL_ON_ERROR,
        kafkaTemplate = "kafkaTemplate"
    )
    @KafkaListener(topics = "${sentinel.kafka.topic.classification-requests:classification.requests}",
            groupId = "sentinel-classifier-ingress")
    public void processClassificationRequest(String rawJson) {
        log.debug("Received classification request: {}", rawJson);
        try {
            ClassifyTransactionRequest request = objectMapper.readValue(rawJson, ClassifyTransactionRequest.class);
            if (request.getText() == null) {
                throw new IllegalArgumentException("Classification request without text");
            }
            ClassificationResponse response = classificationService.classify(request);
            log.info("Classified request from Kafka as transaction {}: {}",
                    response.getTransaction().getId(), response.getMessage());
        } catch (Exception e) {
            log.error("Error processing classification request: {}", rawJson, e);
            throw new IllegalStateException("Classification request failed", e); // Throwing ensures the Retry mechanism triggers
        }
    }
}
